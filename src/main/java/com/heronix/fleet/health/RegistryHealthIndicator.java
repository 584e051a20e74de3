package com.heronix.fleet.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.fleet.model.dto.RegistryStatsDTO;
import com.heronix.fleet.model.dto.SweeperStatusDTO;
import com.heronix.fleet.service.DeviceRegistrationService;
import com.heronix.fleet.service.LivenessSweeper;

import lombok.RequiredArgsConstructor;

/**
 * Actuator health indicator for the device registry.
 *
 * Reports UP while the liveness sweeper is running. A stopped sweeper means
 * silent devices are never aged out, so the registry reports OUT_OF_SERVICE
 * unless periodic sweeping was switched off in configuration.
 */
@Component
@RequiredArgsConstructor
public class RegistryHealthIndicator implements HealthIndicator {

    private final DeviceRegistrationService registrationService;
    private final LivenessSweeper livenessSweeper;

    @Override
    public Health health() {
        RegistryStatsDTO stats = registrationService.stats();
        SweeperStatusDTO sweeper = livenessSweeper.getStatus();

        Health.Builder builder = sweeper.isRunning() || !livenessSweeper.isAutoStartup()
                ? Health.up()
                : Health.outOfService();

        return builder
                .withDetail("total-devices", stats.getTotalDevices())
                .withDetail("active-devices", stats.getActiveDevices())
                .withDetail("inactive-devices", stats.getInactiveDevices())
                .withDetail("sweeper", sweeper.isRunning() ? "running" : "stopped")
                .withDetail("sweep-interval-seconds", sweeper.getIntervalSeconds())
                .withDetail("failed-sweeps", sweeper.getFailedRuns())
                .build();
    }
}
