package com.heronix.fleet.health;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.fleet.heartbeat.HeartbeatClient;
import com.heronix.fleet.model.dto.HeartbeatStatusDTO;

/**
 * Actuator health indicator for the device-side heartbeat agent.
 *
 * Reports UP with mode "controller" when the agent is not loaded
 * (heronix.fleet.heartbeat.enabled=false). In agent mode, DOWN once heartbeats
 * have been failing for more than three intervals.
 */
@Component
public class HeartbeatHealthIndicator implements HealthIndicator {

    @Autowired(required = false)
    private HeartbeatClient heartbeatClient;

    @Override
    public Health health() {
        if (heartbeatClient == null) {
            return Health.up()
                    .withDetail("mode", "controller")
                    .withDetail("heartbeat-agent", "disabled")
                    .build();
        }

        HeartbeatStatusDTO status = heartbeatClient.getStatus();
        Health.Builder builder = switch (status.getHealth()) {
            case HEALTHY, DEGRADED -> Health.up();
            case NEVER_SUCCEEDED -> Health.unknown();
            case UNHEALTHY -> Health.down();
        };

        return builder
                .withDetail("mode", "device-agent")
                .withDetail("device-id", status.getDeviceId())
                .withDetail("heartbeat", status.getHealth().getCode())
                .withDetail("running", status.isRunning())
                .withDetail("heartbeat-count", status.getHeartbeatCount())
                .withDetail("failure-count", status.getFailureCount())
                .build();
    }
}
