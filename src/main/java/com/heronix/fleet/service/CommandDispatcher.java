package com.heronix.fleet.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.heronix.fleet.adapter.DeviceEndpointClient;
import com.heronix.fleet.adapter.DeviceResponse;
import com.heronix.fleet.config.FleetProperties;
import com.heronix.fleet.event.DeviceLifecycleEvent;
import com.heronix.fleet.exception.DeviceCommunicationException;
import com.heronix.fleet.model.domain.CommandRoute;
import com.heronix.fleet.model.domain.DeviceRecord;
import com.heronix.fleet.model.enums.DeviceEventType;
import com.heronix.fleet.model.enums.DeviceStatus;
import com.heronix.fleet.model.enums.DeviceType;
import com.heronix.fleet.registry.DeviceRecordStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Forwards logical commands to registered devices.
 *
 * The store is consulted before the call and updated after a failure; each of
 * those is its own short critical section. The device call itself runs without
 * any registry lock, so a slow device never blocks the rest of the fleet.
 *
 * Failures are counted but not retried here. A successful command leaves the
 * failure count alone; only a heartbeat resets it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommandDispatcher {

    private final DeviceRecordStore store;
    private final DeviceEndpointClient endpointClient;
    private final FleetProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Send {@code command} to {@code deviceId}.
     *
     * @param parameters optional JSON parameters forwarded as the request body
     */
    public DispatchResult dispatch(String deviceId, String command, Map<String, Object> parameters) {
        Optional<DeviceRecord> found = store.get(deviceId);
        if (found.isEmpty()) {
            return DispatchResult.notFound(deviceId);
        }
        DeviceRecord device = found.get();

        Instant now = clock.instant();
        Duration inactiveThreshold = Duration.ofSeconds(properties.getLiveness().getInactiveThresholdSeconds());
        DeviceStatus status = device.effectiveStatus(now, inactiveThreshold);
        if (status != DeviceStatus.ACTIVE) {
            log.info("Refusing command '{}' for {}: device is {}", command, deviceId, status.getCode());
            return DispatchResult.notActive(deviceId, status);
        }

        Optional<CommandRoute> route = device.getDeviceType().routeFor(command);
        if (route.isEmpty()) {
            return DispatchResult.unsupportedCommand(command, device.getDeviceType().getCode());
        }

        Map<String, Object> body = parameters == null || parameters.isEmpty() ? null : parameters;
        Duration timeout = Duration.ofSeconds(properties.getDispatch().getTimeoutSeconds());

        DeviceResponse response;
        try {
            response = endpointClient.send(device.getEndpoint(), route.get().method(), route.get().path(), body, timeout);
        } catch (DeviceCommunicationException e) {
            int failures = recordFailure(device, command, e.getMessage());
            return DispatchResult.communicationError(device.getDeviceId(), e.getMessage(), failures);
        }

        if (!response.isSuccess()) {
            int failures = recordFailure(device, command, "device status " + response.statusCode());
            return DispatchResult.deviceError(device.getDeviceId(), response, failures);
        }

        log.info("Command '{}' delivered to {} ({})", command, device.getDeviceId(), device.getEndpoint());
        return DispatchResult.success(response);
    }

    /**
     * Command names accepted for a device type.
     */
    public Set<String> supportedCommands(DeviceType type) {
        return type.getCommands().keySet();
    }

    private int recordFailure(DeviceRecord device, String command, String reason) {
        int failures = store.incrementFailure(device.getDeviceId());
        eventPublisher.publishEvent(new DeviceLifecycleEvent(DeviceEventType.DISPATCH_FAILURE,
                device.getDeviceId(), device.getDeviceType(), clock.instant(),
                Map.of("command", command, "reason", String.valueOf(reason), "failure_count", failures)));
        return failures;
    }
}
