package com.heronix.fleet.exception;

import lombok.Getter;

/**
 * Exception thrown when the main controller answers a registration with a
 * client-error status. The request itself is wrong, so retrying it cannot help.
 */
@Getter
public class RegistrationRejectedException extends RuntimeException {

    private final int statusCode;

    public RegistrationRejectedException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
}
