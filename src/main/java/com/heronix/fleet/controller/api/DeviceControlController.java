package com.heronix.fleet.controller.api;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.fleet.adapter.DeviceResponse;
import com.heronix.fleet.model.dto.SweeperStatusDTO;
import com.heronix.fleet.service.CommandDispatcher;
import com.heronix.fleet.service.DispatchResult;
import com.heronix.fleet.service.LivenessSweeper;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for sending commands to devices and for registry maintenance.
 */
@RestController
@RequestMapping(DeviceRegistryController.BASE_PATH)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Device Control", description = "APIs for forwarding commands to devices and cleaning up the registry")
public class DeviceControlController {

    private final CommandDispatcher commandDispatcher;
    private final LivenessSweeper livenessSweeper;
    private final ObjectMapper objectMapper;
    private final ErrorResponses errorResponses;
    private final Clock clock;

    @PostMapping("/control/{deviceId}/{command}")
    @Operation(summary = "Send command", description = "Forward a command to an active device")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device accepted the command"),
        @ApiResponse(responseCode = "400", description = "Unknown command, inactive device or device error"),
        @ApiResponse(responseCode = "404", description = "Device not found"),
        @ApiResponse(responseCode = "503", description = "Device unreachable")
    })
    public ResponseEntity<Map<String, Object>> sendCommand(
            @PathVariable String deviceId,
            @PathVariable String command,
            @RequestBody(required = false) CommandRequest request) {

        Map<String, Object> parameters = request != null ? request.parameters() : null;
        DispatchResult result = commandDispatcher.dispatch(deviceId, command, parameters);

        Map<String, Object> response = new LinkedHashMap<>();
        if (result.success()) {
            response.put("message", "Command \"" + command + "\" sent successfully to device " + deviceId);
            response.put("device_id", deviceId);
            response.put("command", command);
            response.put("device_response", parseDeviceBody(result.deviceResponse()));
            response.put("status", "success");
            response.put("timestamp", clock.instant());
            return ResponseEntity.ok(response);
        }

        response.putAll(errorResponses.body(result.errorKind(), result.message()));
        response.put("device_id", deviceId);
        response.put("command", command);

        switch (result.errorKind()) {
            case NOT_ACTIVE -> response.put("device_status", result.deviceStatus().getCode());
            case COMMUNICATION_ERROR -> response.put("failure_count", result.failureCount());
            case DEVICE_ERROR -> {
                response.put("device_status_code", result.deviceResponse().statusCode());
                response.put("device_response", result.deviceResponse().hasBody()
                        ? result.deviceResponse().body() : null);
                response.put("failure_count", result.failureCount());
            }
            default -> {
            }
        }
        return ResponseEntity.status(result.errorKind().getHttpStatus()).body(response);
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Force cleanup", description = "Run a liveness sweep now and return the removed devices")
    @ApiResponse(responseCode = "200", description = "Sweep completed")
    public ResponseEntity<Map<String, Object>> forceCleanup() {
        List<String> removed = livenessSweeper.forceSweep();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Cleanup completed successfully");
        response.put("removed_devices", removed);
        response.put("removed_count", removed.size());
        response.put("status", "success");
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/cleanup/status")
    @Operation(summary = "Sweeper status", description = "Interval, thresholds and last run of the liveness sweeper")
    public ResponseEntity<SweeperStatusDTO> getCleanupStatus() {
        return ResponseEntity.ok(livenessSweeper.getStatus());
    }

    @PutMapping("/cleanup/interval")
    @Operation(summary = "Change sweep interval", description = "Reschedule the liveness sweeper with a new interval")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Interval updated"),
        @ApiResponse(responseCode = "400", description = "Interval not positive")
    })
    public ResponseEntity<?> updateCleanupInterval(
            @RequestParam(name = "interval_seconds") long intervalSeconds) {
        if (intervalSeconds <= 0) {
            return errorResponses.invalidInterval(intervalSeconds);
        }
        livenessSweeper.updateInterval(intervalSeconds);
        return ResponseEntity.ok(livenessSweeper.getStatus());
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    /**
     * Device payload as JSON when it parses, otherwise the raw text.
     */
    private Object parseDeviceBody(DeviceResponse deviceResponse) {
        if (deviceResponse == null || !deviceResponse.hasBody()) {
            return null;
        }
        try {
            return objectMapper.readTree(deviceResponse.body());
        } catch (JsonProcessingException e) {
            log.debug("Device response is not JSON, returning it as text");
            return deviceResponse.body();
        }
    }

    public record CommandRequest(Map<String, Object> parameters) {}
}
