package com.heronix.fleet.model.dto;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State of the liveness sweeper.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SweeperStatusDTO {

    private boolean running;

    private long intervalSeconds;

    private long inactiveThresholdSeconds;

    private long removalThresholdSeconds;

    /**
     * Start of the most recent sweep, scheduled or forced.
     */
    private Instant lastRunAt;

    /**
     * Devices removed by the most recent sweep.
     */
    private int lastRemovedCount;

    /**
     * Expected start of the next scheduled sweep, null when stopped.
     */
    private Instant nextRunAt;

    /**
     * Sweeps that ended with an unexpected error.
     */
    private long failedRuns;
}
