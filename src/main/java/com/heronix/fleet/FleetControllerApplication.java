package com.heronix.fleet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.fleet.config.FleetProperties;

/**
 * Heronix Fleet Controller - central registry for network-attached devices.
 *
 * Devices register themselves and keep their registration alive with periodic
 * heartbeats. The controller ages silent devices out of the registry and
 * forwards commands only to devices it currently believes reachable.
 *
 * The same artifact runs as a device-side heartbeat agent when
 * heronix.fleet.heartbeat.enabled=true.
 */
@SpringBootApplication
@EnableConfigurationProperties(FleetProperties.class)
public class FleetControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetControllerApplication.class, args);
    }
}
