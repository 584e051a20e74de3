package com.heronix.fleet.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Liveness status of a registered device.
 *
 * Never set directly by callers: a registration or heartbeat makes a device
 * ACTIVE and elapsed time without one makes it INACTIVE.
 */
@Getter
@RequiredArgsConstructor
public enum DeviceStatus {

    ACTIVE("active"),

    INACTIVE("inactive");

    @JsonValue
    private final String code;
}
