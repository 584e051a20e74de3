package com.heronix.fleet.model.domain;

/**
 * Network address and port a device's API listens on.
 */
public record DeviceEndpoint(String ipAddress, int port) {

    public String baseUrl() {
        return "http://" + ipAddress + ":" + port;
    }

    @Override
    public String toString() {
        return ipAddress + ":" + port;
    }
}
