package com.heronix.fleet.event;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes device lifecycle events to the log as key=value pairs.
 */
@Component
@Slf4j
public class DeviceEventLogger {

    @EventListener
    public void onDeviceEvent(DeviceLifecycleEvent event) {
        String details = new TreeMap<>(event.details()).entrySet().stream()
                .map(Map.Entry::toString)
                .collect(Collectors.joining(" "));

        switch (event.type()) {
            case REMOVED_STALE, MARKED_INACTIVE, DISPATCH_FAILURE -> log.warn(
                    "event={} device_id={} device_type={} at={} {}",
                    event.type().getCode(), event.deviceId(), event.deviceType().getCode(),
                    event.occurredAt(), details);
            default -> log.info(
                    "event={} device_id={} device_type={} at={} {}",
                    event.type().getCode(), event.deviceId(), event.deviceType().getCode(),
                    event.occurredAt(), details);
        }
    }
}
