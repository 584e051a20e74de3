package com.heronix.fleet.adapter;

/**
 * Raw answer from a device API.
 *
 * @param statusCode HTTP status returned by the device
 * @param body       response body as sent, empty when there was none
 */
public record DeviceResponse(int statusCode, String body) {

    public DeviceResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean hasBody() {
        return !body.isEmpty();
    }
}
