package com.heronix.fleet.adapter;

import java.time.Duration;
import java.util.Map;

import org.springframework.http.HttpMethod;

import com.heronix.fleet.exception.DeviceCommunicationException;
import com.heronix.fleet.model.domain.DeviceEndpoint;

/**
 * Transport used to reach a device's API.
 *
 * Implementations never throw for an HTTP error status; the status is part of
 * the returned {@link DeviceResponse}. Only a failure to complete the exchange
 * is reported as {@link DeviceCommunicationException}.
 */
public interface DeviceEndpointClient {

    /**
     * Issue {@code method http://ip:port/path} with an optional JSON body.
     *
     * @param endpoint device address
     * @param method   HTTP method
     * @param path     request path, starting with '/'
     * @param body     JSON body, or null for none
     * @param timeout  upper bound for the whole exchange
     * @return the device's answer
     * @throws DeviceCommunicationException when the device could not be reached in time
     */
    DeviceResponse send(DeviceEndpoint endpoint, HttpMethod method, String path,
                        Map<String, Object> body, Duration timeout) throws DeviceCommunicationException;
}
