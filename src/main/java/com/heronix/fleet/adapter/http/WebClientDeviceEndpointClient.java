package com.heronix.fleet.adapter.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.heronix.fleet.adapter.DeviceEndpointClient;
import com.heronix.fleet.adapter.DeviceResponse;
import com.heronix.fleet.exception.DeviceCommunicationException;
import com.heronix.fleet.model.domain.DeviceEndpoint;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

/**
 * HTTP client for device APIs built on Spring WebClient.
 *
 * The whole exchange, body included, is bounded by the caller's timeout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebClientDeviceEndpointClient implements DeviceEndpointClient {

    private final WebClient.Builder webClientBuilder;

    @Override
    public DeviceResponse send(DeviceEndpoint endpoint, HttpMethod method, String path,
                               Map<String, Object> body, Duration timeout) throws DeviceCommunicationException {
        WebClient client = createClient(endpoint);

        WebClient.RequestBodySpec request = client.method(method).uri(path);
        WebClient.RequestHeadersSpec<?> spec = body != null ? request.bodyValue(body) : request;

        try {
            DeviceResponse response = spec
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new DeviceResponse(clientResponse.statusCode().value(), text)))
                    .timeout(timeout)
                    .block();

            if (response == null) {
                throw new DeviceCommunicationException("Empty exchange with " + endpoint);
            }
            log.debug("{} {}{} -> {}", method, endpoint.baseUrl(), path, response.statusCode());
            return response;

        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String reason = cause instanceof TimeoutException
                    ? "Request timeout to " + endpoint
                    : "Connection error to " + endpoint + ": " + cause.getMessage();
            log.debug("{} {}{} failed: {}", method, endpoint.baseUrl(), path, reason);
            throw new DeviceCommunicationException(reason, cause);
        }
    }

    private WebClient createClient(DeviceEndpoint endpoint) {
        return webClientBuilder.clone()
                .baseUrl(endpoint.baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
