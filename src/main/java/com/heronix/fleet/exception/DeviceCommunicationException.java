package com.heronix.fleet.exception;

/**
 * Exception thrown when a network peer cannot be reached: connection refused,
 * timeout, or a broken exchange.
 */
public class DeviceCommunicationException extends Exception {

    public DeviceCommunicationException(String message) {
        super(message);
    }

    public DeviceCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
