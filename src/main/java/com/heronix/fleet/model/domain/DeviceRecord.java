package com.heronix.fleet.model.domain;

import java.time.Duration;
import java.time.Instant;

import com.heronix.fleet.model.enums.DeviceStatus;
import com.heronix.fleet.model.enums.DeviceType;

import lombok.Builder;
import lombok.Value;

/**
 * Registration state of one device.
 *
 * Instances are immutable snapshots. The record store replaces the whole value
 * on every change, so a reader never sees a half-applied update.
 */
@Value
@Builder(toBuilder = true)
public class DeviceRecord {

    /**
     * Identifier supplied by the device, fixed at creation
     */
    String deviceId;

    DeviceType deviceType;

    DeviceEndpoint endpoint;

    /**
     * Status as last written by a registration or a sweep
     */
    DeviceStatus status;

    Instant createdAt;

    Instant lastSeen;

    /**
     * Dispatch failures since the last heartbeat
     */
    int failureCount;

    /**
     * Time elapsed since the last registration or heartbeat.
     */
    public Duration silenceAt(Instant now) {
        return Duration.between(lastSeen, now);
    }

    /**
     * Status as of {@code now}. A device whose silence exceeds the inactive
     * threshold is INACTIVE even before a sweep has rewritten its stored status.
     */
    public DeviceStatus effectiveStatus(Instant now, Duration inactiveThreshold) {
        if (status == DeviceStatus.INACTIVE || silenceAt(now).compareTo(inactiveThreshold) > 0) {
            return DeviceStatus.INACTIVE;
        }
        return DeviceStatus.ACTIVE;
    }
}
