package com.heronix.fleet.model.enums;

import org.springframework.http.HttpStatus;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of failure the registry and dispatcher report to their callers.
 *
 * Only {@link #COMMUNICATION_ERROR} is worth retrying; every other kind is a
 * terminal answer for the request that produced it.
 */
@Getter
@RequiredArgsConstructor
public enum FleetErrorKind {

    /**
     * Malformed input
     */
    VALIDATION_ERROR("validation_error", HttpStatus.BAD_REQUEST, false),

    /**
     * A second device tried to claim an id registered from another address
     */
    IDENTITY_CONFLICT("identity_conflict", HttpStatus.BAD_REQUEST, false),

    /**
     * The per-type population limit is reached
     */
    CAPACITY_EXCEEDED("device_type_limit_exceeded", HttpStatus.CONFLICT, false),

    NOT_FOUND("not_found", HttpStatus.NOT_FOUND, false),

    NOT_ACTIVE("device_not_active", HttpStatus.BAD_REQUEST, false),

    UNSUPPORTED_COMMAND("unsupported_command", HttpStatus.BAD_REQUEST, false),

    /**
     * The device could not be reached (timeout, refused connection)
     */
    COMMUNICATION_ERROR("communication_error", HttpStatus.SERVICE_UNAVAILABLE, true),

    /**
     * The device answered with a non-success status
     */
    DEVICE_ERROR("device_error", HttpStatus.BAD_REQUEST, false),

    INTERNAL_ERROR("internal_error", HttpStatus.INTERNAL_SERVER_ERROR, false);

    /**
     * Code reported in error bodies as error_type
     */
    private final String code;

    private final HttpStatus httpStatus;

    private final boolean retryable;
}
