package com.heronix.fleet.event;

import java.time.Instant;
import java.util.Map;

import com.heronix.fleet.model.enums.DeviceEventType;
import com.heronix.fleet.model.enums.DeviceType;

/**
 * Structured lifecycle event for one device, published on the application
 * event bus.
 *
 * @param type       what happened
 * @param deviceId   device the event concerns
 * @param deviceType type of that device
 * @param occurredAt registry time of the event
 * @param details    event-specific attributes (address, failure count, ...)
 */
public record DeviceLifecycleEvent(
        DeviceEventType type,
        String deviceId,
        DeviceType deviceType,
        Instant occurredAt,
        Map<String, Object> details
) {
    public DeviceLifecycleEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
