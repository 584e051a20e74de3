package com.heronix.fleet.service;

import com.heronix.fleet.model.domain.DeviceRecord;
import com.heronix.fleet.model.enums.DeviceEventType;
import com.heronix.fleet.model.enums.FleetErrorKind;

/**
 * Outcome of a registration or heartbeat.
 *
 * @param success   whether the registry accepted the call
 * @param eventType NEW_DEVICE or HEARTBEAT_UPDATE on success
 * @param errorKind reason for rejection, null on success
 * @param message   human-readable detail
 * @param record    the stored record on success
 */
public record RegistrationResult(
        boolean success,
        DeviceEventType eventType,
        FleetErrorKind errorKind,
        String message,
        DeviceRecord record
) {
    public static RegistrationResult accepted(DeviceEventType eventType, DeviceRecord record) {
        String message = eventType == DeviceEventType.NEW_DEVICE
                ? "Device registered successfully"
                : "Device heartbeat recorded";
        return new RegistrationResult(true, eventType, null, message, record);
    }

    public static RegistrationResult rejected(FleetErrorKind errorKind, String message) {
        return new RegistrationResult(false, null, errorKind, message, null);
    }
}
