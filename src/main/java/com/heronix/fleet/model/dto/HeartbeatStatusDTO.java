package com.heronix.fleet.model.dto;

import java.time.Instant;

import com.heronix.fleet.model.enums.HeartbeatHealth;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State and counters of the device-side heartbeat agent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HeartbeatStatusDTO {

    private String deviceId;

    private String deviceType;

    private boolean running;

    private long intervalSeconds;

    private int retryAttempts;

    private long retryDelaySeconds;

    /**
     * Heartbeats accepted by the controller.
     */
    private long heartbeatCount;

    /**
     * Failed attempts, each retry counted separately.
     */
    private long failureCount;

    private Instant lastSuccess;

    private Instant lastFailure;

    private HeartbeatHealth health;
}
