package com.heronix.fleet.service;

import com.heronix.fleet.adapter.DeviceResponse;
import com.heronix.fleet.model.enums.DeviceStatus;
import com.heronix.fleet.model.enums.FleetErrorKind;

/**
 * Outcome of forwarding a command to a device.
 *
 * @param success        whether the device accepted the command
 * @param errorKind      reason for failure, null on success
 * @param message        human-readable detail
 * @param deviceResponse the device's answer, unmodified (present on success and on DEVICE_ERROR)
 * @param deviceStatus   effective status of the device when it was not active
 * @param failureCount   failure count after a transport or device failure, otherwise -1
 */
public record DispatchResult(
        boolean success,
        FleetErrorKind errorKind,
        String message,
        DeviceResponse deviceResponse,
        DeviceStatus deviceStatus,
        int failureCount
) {
    public static DispatchResult success(DeviceResponse response) {
        return new DispatchResult(true, null, "Command sent successfully", response, null, -1);
    }

    public static DispatchResult notFound(String deviceId) {
        return new DispatchResult(false, FleetErrorKind.NOT_FOUND,
                "Device not found: " + deviceId, null, null, -1);
    }

    public static DispatchResult notActive(String deviceId, DeviceStatus status) {
        return new DispatchResult(false, FleetErrorKind.NOT_ACTIVE,
                "Device " + deviceId + " is not active", null, status, -1);
    }

    public static DispatchResult unsupportedCommand(String command, String deviceTypeCode) {
        return new DispatchResult(false, FleetErrorKind.UNSUPPORTED_COMMAND,
                "Invalid command \"" + command + "\" for device type \"" + deviceTypeCode + "\"", null, null, -1);
    }

    public static DispatchResult communicationError(String deviceId, String reason, int failureCount) {
        return new DispatchResult(false, FleetErrorKind.COMMUNICATION_ERROR,
                "Failed to communicate with device " + deviceId + ": " + reason, null, null, failureCount);
    }

    public static DispatchResult deviceError(String deviceId, DeviceResponse response, int failureCount) {
        return new DispatchResult(false, FleetErrorKind.DEVICE_ERROR,
                "Device " + deviceId + " returned error: " + response.statusCode(), response, null, failureCount);
    }
}
