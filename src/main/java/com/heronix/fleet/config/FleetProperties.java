package com.heronix.fleet.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.heronix.fleet.model.enums.DeviceType;

import lombok.Data;

/**
 * Configuration properties for the Heronix Fleet Controller.
 */
@Data
@ConfigurationProperties(prefix = "heronix.fleet")
public class FleetProperties {

    /**
     * Registry configuration
     */
    private RegistryConfig registry = new RegistryConfig();

    /**
     * Liveness sweeper configuration
     */
    private LivenessConfig liveness = new LivenessConfig();

    /**
     * Command dispatch configuration
     */
    private DispatchConfig dispatch = new DispatchConfig();

    /**
     * Device-side heartbeat agent configuration
     */
    private HeartbeatConfig heartbeat = new HeartbeatConfig();

    @Data
    public static class RegistryConfig {
        /**
         * Maximum number of simultaneously registered devices per type, keyed by
         * the type's wire code (e.g. rear-camera). Types without an entry fall
         * back to {@link DeviceType#getDefaultLimit()}.
         */
        private Map<String, Integer> typeLimits = new LinkedHashMap<>();

        public int limitFor(DeviceType type) {
            Integer configured = typeLimits.get(type.getCode());
            return configured != null ? configured : type.getDefaultLimit();
        }
    }

    @Data
    public static class LivenessConfig {
        /**
         * Run the periodic sweep. When false only forced sweeps happen.
         */
        private boolean enabled = true;

        /**
         * Seconds without a heartbeat before a device is considered inactive
         */
        private long inactiveThresholdSeconds = 120;

        /**
         * Seconds without a heartbeat before a device is removed.
         * Must be strictly larger than the inactive threshold.
         */
        private long removalThresholdSeconds = 300;

        /**
         * Seconds between two sweeps
         */
        private long sweepIntervalSeconds = 60;
    }

    @Data
    public static class DispatchConfig {
        /**
         * Timeout for one command forwarded to a device, in seconds
         */
        private int timeoutSeconds = 10;
    }

    @Data
    public static class HeartbeatConfig {
        /**
         * Run this process as a device-side heartbeat agent
         */
        private boolean enabled = false;

        /**
         * Base URL of the main controller
         */
        private String controllerUrl = "http://192.168.4.1:5000";

        /**
         * Identifier this device registers under
         */
        private String deviceId = "rear-camera-001";

        /**
         * Wire code of this device's type
         */
        private String deviceType = DeviceType.REAR_CAMERA.getCode();

        /**
         * Address the controller should use to reach this device
         */
        private String advertisedAddress = "192.168.4.100";

        /**
         * Port the device API listens on
         */
        private int port = 5001;

        /**
         * Seconds between heartbeats
         */
        private long intervalSeconds = 30;

        /**
         * Attempts per heartbeat before giving up until the next interval
         */
        private int retryAttempts = 3;

        /**
         * Seconds to wait between two attempts of the same heartbeat
         */
        private long retryDelaySeconds = 5;

        /**
         * Timeout for one registration request, in seconds
         */
        private int requestTimeoutSeconds = 10;

        /**
         * Maximum seconds stop() waits for an in-flight heartbeat
         */
        private long stopTimeoutSeconds = 5;
    }
}
