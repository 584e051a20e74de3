package com.heronix.fleet.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.heronix.fleet.config.FleetProperties;
import com.heronix.fleet.event.DeviceLifecycleEvent;
import com.heronix.fleet.model.domain.DeviceEndpoint;
import com.heronix.fleet.model.domain.DeviceRecord;
import com.heronix.fleet.model.dto.RegistryStatsDTO;
import com.heronix.fleet.model.enums.DeviceEventType;
import com.heronix.fleet.model.enums.DeviceStatus;
import com.heronix.fleet.model.enums.DeviceType;
import com.heronix.fleet.model.enums.FleetErrorKind;
import com.heronix.fleet.registry.DeviceFilter;
import com.heronix.fleet.registry.DeviceRecordStore;
import com.heronix.fleet.registry.UpsertResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies device registrations and heartbeats to the record store.
 *
 * A registration for an unknown id creates the device when its type still has
 * capacity. A registration for a known id is a heartbeat and is accepted only
 * from the address already on file, so one device cannot take over another
 * device's id.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceRegistrationService {

    private static final int MAX_DEVICE_ID_LENGTH = 128;
    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    private final DeviceRecordStore store;
    private final FleetProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ========================================================================
    // REGISTRATION & HEARTBEAT
    // ========================================================================

    /**
     * Register a new device or record a heartbeat from a known one.
     *
     * @param deviceId      identifier supplied by the device
     * @param typeCode      wire code of the device type
     * @param sourceAddress address the device is reachable at
     * @param port          port the device API listens on
     */
    public RegistrationResult registerOrHeartbeat(String deviceId, String typeCode, String sourceAddress, Integer port) {
        if (deviceId == null || deviceId.isBlank()) {
            return RegistrationResult.rejected(FleetErrorKind.VALIDATION_ERROR, "Device ID must be a non-empty string");
        }
        if (deviceId.trim().length() > MAX_DEVICE_ID_LENGTH) {
            return RegistrationResult.rejected(FleetErrorKind.VALIDATION_ERROR,
                    "Device ID must be at most " + MAX_DEVICE_ID_LENGTH + " characters");
        }

        Optional<DeviceType> type = DeviceType.fromCode(typeCode);
        if (type.isEmpty()) {
            return RegistrationResult.rejected(FleetErrorKind.VALIDATION_ERROR, "Invalid device type: " + typeCode);
        }
        if (!isValidIpAddress(sourceAddress)) {
            return RegistrationResult.rejected(FleetErrorKind.VALIDATION_ERROR, "Invalid IP address: " + sourceAddress);
        }
        if (port == null || port < 1 || port > 65535) {
            return RegistrationResult.rejected(FleetErrorKind.VALIDATION_ERROR, "Invalid port: " + port);
        }

        DeviceType deviceType = type.get();
        int limit = properties.getRegistry().limitFor(deviceType);
        Instant now = clock.instant();

        UpsertResult result = store.upsert(deviceId, deviceType, new DeviceEndpoint(sourceAddress, port), limit, now);

        switch (result.kind()) {
            case CREATED -> {
                publish(DeviceEventType.NEW_DEVICE, result.record(), now,
                        Map.of("ip_address", sourceAddress, "port", port));
                return RegistrationResult.accepted(DeviceEventType.NEW_DEVICE, result.record());
            }
            case UPDATED -> {
                publish(DeviceEventType.HEARTBEAT_UPDATE, result.record(), now,
                        Map.of("ip_address", sourceAddress, "port", port));
                return RegistrationResult.accepted(DeviceEventType.HEARTBEAT_UPDATE, result.record());
            }
            case CAPACITY_EXCEEDED -> {
                log.warn("Rejected registration of {}: device type '{}' limit reached ({}/{})",
                        deviceId, deviceType.getCode(), result.currentCount(), result.limit());
                return RegistrationResult.rejected(FleetErrorKind.CAPACITY_EXCEEDED,
                        "Device type '" + deviceType.getCode() + "' limit exceeded. Current: "
                                + result.currentCount() + ", Max: " + result.limit());
            }
            case IDENTITY_CONFLICT -> {
                log.warn("Rejected registration of {} from {}: id is registered from {}",
                        deviceId, sourceAddress, result.record().getEndpoint().ipAddress());
                return RegistrationResult.rejected(FleetErrorKind.IDENTITY_CONFLICT,
                        "Device ID '" + deviceId + "' is already registered from a different address");
            }
            case TYPE_MISMATCH -> {
                return RegistrationResult.rejected(FleetErrorKind.VALIDATION_ERROR,
                        "Device '" + deviceId + "' is registered as type '"
                                + result.record().getDeviceType().getCode() + "'");
            }
            default -> throw new IllegalStateException("Unhandled upsert outcome: " + result.kind());
        }
    }

    // ========================================================================
    // QUERIES & REMOVAL
    // ========================================================================

    public Optional<DeviceRecord> getDevice(String deviceId) {
        return store.get(deviceId);
    }

    /**
     * List registered devices.
     *
     * @param activeOnly only devices currently considered active
     * @param typeCode   optional device type filter; an unknown code matches nothing
     */
    public List<DeviceRecord> listDevices(boolean activeOnly, String typeCode) {
        DeviceType type = null;
        if (typeCode != null && !typeCode.isBlank()) {
            Optional<DeviceType> parsed = DeviceType.fromCode(typeCode);
            if (parsed.isEmpty()) {
                return List.of();
            }
            type = parsed.get();
        }
        return store.list(new DeviceFilter(type, activeOnly, clock.instant(), inactiveThreshold()));
    }

    /**
     * Remove a device on explicit request.
     *
     * @return true when the device was registered
     */
    public boolean removeDevice(String deviceId) {
        Optional<DeviceRecord> removed = store.remove(deviceId);
        removed.ifPresent(record -> publish(DeviceEventType.REMOVED_MANUAL, record, clock.instant(),
                Map.of("reason", "manual_removal")));
        return removed.isPresent();
    }

    /**
     * Status of {@code record} as of now, taking unswept silence into account.
     */
    public DeviceStatus effectiveStatus(DeviceRecord record) {
        return record.effectiveStatus(clock.instant(), inactiveThreshold());
    }

    public RegistryStatsDTO stats() {
        return store.snapshotStats(clock.instant(), inactiveThreshold(), typeLimits());
    }

    /**
     * Effective population limit per device type code.
     */
    public Map<String, Integer> typeLimits() {
        Map<String, Integer> limits = new LinkedHashMap<>();
        Arrays.stream(DeviceType.values())
                .forEach(type -> limits.put(type.getCode(), properties.getRegistry().limitFor(type)));
        return limits;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private Duration inactiveThreshold() {
        return Duration.ofSeconds(properties.getLiveness().getInactiveThresholdSeconds());
    }

    private void publish(DeviceEventType type, DeviceRecord record, Instant now, Map<String, Object> details) {
        eventPublisher.publishEvent(
                new DeviceLifecycleEvent(type, record.getDeviceId(), record.getDeviceType(), now, details));
    }

    static boolean isValidIpAddress(String address) {
        return address != null && IPV4.matcher(address).matches();
    }
}
