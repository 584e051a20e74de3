package com.heronix.fleet.model.dto;

import java.time.Instant;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time statistics about the device registry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistryStatsDTO {

    /**
     * Total number of registered devices.
     */
    private int totalDevices;

    /**
     * Devices whose effective status is active.
     */
    private int activeDevices;

    /**
     * Devices whose effective status is inactive.
     */
    private int inactiveDevices;

    /**
     * Breakdown by device type code.
     */
    private Map<String, Integer> devicesByType;

    /**
     * Configured population limit per device type code.
     */
    private Map<String, Integer> deviceTypeLimits;

    /**
     * When the snapshot was taken.
     */
    private Instant generatedAt;
}
