package com.heronix.fleet.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Health of the device-side heartbeat agent, derived from its success and
 * failure history.
 */
@Getter
@RequiredArgsConstructor
public enum HeartbeatHealth {

    /**
     * No heartbeat has been accepted yet
     */
    NEVER_SUCCEEDED("never_succeeded"),

    /**
     * The latest outcome was a success
     */
    HEALTHY("healthy"),

    /**
     * The latest outcome was a failure, but a success happened within three intervals
     */
    DEGRADED("degraded"),

    /**
     * No success for more than three intervals
     */
    UNHEALTHY("unhealthy");

    @JsonValue
    private final String code;
}
