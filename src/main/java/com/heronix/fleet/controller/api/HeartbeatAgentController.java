package com.heronix.fleet.controller.api;

import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.fleet.heartbeat.HeartbeatClient;
import com.heronix.fleet.model.dto.HeartbeatStatusDTO;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * REST API for inspecting and steering the heartbeat agent when this process
 * runs on a device.
 */
@RestController
@RequestMapping("/api/v1/heartbeat")
@ConditionalOnProperty(name = "heronix.fleet.heartbeat.enabled", havingValue = "true")
@RequiredArgsConstructor
@Tag(name = "Heartbeat Agent", description = "APIs for the device-side heartbeat agent")
public class HeartbeatAgentController {

    private final HeartbeatClient heartbeatClient;
    private final ErrorResponses errorResponses;

    @GetMapping("/status")
    @Operation(summary = "Heartbeat status", description = "Counters, timestamps and health of the heartbeat agent")
    public ResponseEntity<HeartbeatStatusDTO> getStatus() {
        return ResponseEntity.ok(heartbeatClient.getStatus());
    }

    @PostMapping("/force")
    @Operation(summary = "Force heartbeat", description = "Send a heartbeat to the main controller now")
    public ResponseEntity<Map<String, Object>> forceHeartbeat() {
        boolean accepted = heartbeatClient.forceHeartbeat();
        return ResponseEntity.ok(Map.of(
                "success", accepted,
                "health", heartbeatClient.health().getCode()
        ));
    }

    @PutMapping("/interval")
    @Operation(summary = "Change heartbeat interval", description = "Applied from the next heartbeat")
    public ResponseEntity<?> updateInterval(
            @RequestParam(name = "interval_seconds") long intervalSeconds) {
        if (intervalSeconds <= 0) {
            return errorResponses.invalidInterval(intervalSeconds);
        }
        heartbeatClient.updateInterval(intervalSeconds);
        return ResponseEntity.ok(heartbeatClient.getStatus());
    }

    @PostMapping("/statistics/reset")
    @Operation(summary = "Reset statistics", description = "Clear heartbeat counters and timestamps")
    public ResponseEntity<HeartbeatStatusDTO> resetStatistics() {
        heartbeatClient.resetStatistics();
        return ResponseEntity.ok(heartbeatClient.getStatus());
    }
}
