package com.heronix.fleet.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle events emitted for registered devices.
 */
@Getter
@RequiredArgsConstructor
public enum DeviceEventType {

    NEW_DEVICE("new_device"),

    HEARTBEAT_UPDATE("heartbeat_update"),

    MARKED_INACTIVE("marked_inactive"),

    REMOVED_STALE("removed_stale"),

    REMOVED_MANUAL("removed_manual"),

    DISPATCH_FAILURE("dispatch_failure");

    private final String code;
}
