package com.heronix.fleet.controller.api;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.heronix.fleet.model.domain.DeviceRecord;
import com.heronix.fleet.model.dto.RegistryStatsDTO;
import com.heronix.fleet.model.enums.DeviceStatus;
import com.heronix.fleet.model.enums.DeviceType;
import com.heronix.fleet.service.DeviceRegistrationService;
import com.heronix.fleet.service.RegistrationResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for device registration, heartbeats and registry queries.
 *
 * Devices call {@code PUT /device/{id}} both to register and, periodically,
 * as their heartbeat.
 */
@RestController
@RequestMapping(DeviceRegistryController.BASE_PATH)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Device Registry", description = "APIs for device registration, heartbeats and registry queries")
public class DeviceRegistryController {

    public static final String BASE_PATH = "/api/v1/main-controller";

    private final DeviceRegistrationService registrationService;
    private final ErrorResponses errorResponses;
    private final Clock clock;

    @PutMapping("/device/{deviceId}")
    @Operation(summary = "Register device or record heartbeat",
            description = "Register a new device, or refresh a known device from its registered address")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device registered or heartbeat recorded"),
        @ApiResponse(responseCode = "400", description = "Invalid request or identity conflict"),
        @ApiResponse(responseCode = "409", description = "Device type limit reached")
    })
    public ResponseEntity<Map<String, Object>> registerDevice(
            @PathVariable String deviceId,
            @Valid @RequestBody RegistrationRequest request) {

        RegistrationResult result = registrationService.registerOrHeartbeat(
                deviceId, request.deviceType(), request.ipAddress(), request.port());

        if (!result.success()) {
            return errorResponses.error(result.errorKind(), result.message());
        }

        DeviceRecord record = result.record();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", result.message());
        response.put("device_id", record.getDeviceId());
        response.put("device_type", record.getDeviceType().getCode());
        response.put("event", result.eventType().getCode());
        response.put("status", "success");
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/devices")
    @Operation(summary = "List devices", description = "List registered devices, optionally only active ones or one type")
    @ApiResponse(responseCode = "200", description = "Devices returned")
    public ResponseEntity<Map<String, Object>> listDevices(
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly,
            @RequestParam(name = "device_type", required = false) String deviceType) {

        List<DeviceView> devices = registrationService.listDevices(activeOnly, deviceType).stream()
                .map(this::toView)
                .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("devices", devices);
        response.put("count", devices.size());
        response.put("status", "success");
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/device/{deviceId}")
    @Operation(summary = "Get device", description = "Get the registration state of one device")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device found"),
        @ApiResponse(responseCode = "404", description = "Device not found")
    })
    public ResponseEntity<Map<String, Object>> getDevice(@PathVariable String deviceId) {
        return registrationService.getDevice(deviceId)
                .map(record -> {
                    Map<String, Object> response = new LinkedHashMap<>();
                    response.put("device", toView(record));
                    response.put("status", "success");
                    response.put("timestamp", clock.instant());
                    return ResponseEntity.ok(response);
                })
                .orElseGet(() -> errorResponses.notFound("Device not found: " + deviceId));
    }

    @DeleteMapping("/device/{deviceId}")
    @Operation(summary = "Remove device", description = "Remove a device from the registry")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device removed"),
        @ApiResponse(responseCode = "404", description = "Device not found")
    })
    public ResponseEntity<Map<String, Object>> removeDevice(@PathVariable String deviceId) {
        log.info("Removing device {} on request", deviceId);

        if (!registrationService.removeDevice(deviceId)) {
            return errorResponses.notFound("Device not found: " + deviceId);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Device removed successfully");
        response.put("device_id", deviceId);
        response.put("status", "success");
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/stats")
    @Operation(summary = "Registry statistics", description = "Device counts by status and type")
    @ApiResponse(responseCode = "200", description = "Statistics returned")
    public ResponseEntity<RegistryStatsDTO> getStats() {
        return ResponseEntity.ok(registrationService.stats());
    }

    @GetMapping("/devices/types")
    @Operation(summary = "List device types", description = "Supported device types with their limits and commands")
    public ResponseEntity<List<Map<String, Object>>> listDeviceTypes() {
        Map<String, Integer> limits = registrationService.typeLimits();

        List<Map<String, Object>> types = Arrays.stream(DeviceType.values())
                .map(type -> Map.<String, Object>of(
                        "type", type.getCode(),
                        "display_name", type.getDisplayName(),
                        "limit", limits.get(type.getCode()),
                        "commands", type.getCommands().keySet()
                ))
                .collect(Collectors.toList());

        return ResponseEntity.ok(types);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private DeviceView toView(DeviceRecord record) {
        return DeviceView.fromRecord(record, registrationService.effectiveStatus(record), clock.instant());
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record RegistrationRequest(
            @JsonProperty("device_type") @NotBlank String deviceType,
            @JsonProperty("ip_address") @NotBlank String ipAddress,
            @JsonProperty("port") @NotNull Integer port
    ) {}

    public record DeviceView(
            String deviceId,
            String deviceType,
            String ipAddress,
            int port,
            DeviceStatus status,
            Instant createdAt,
            Instant lastSeen,
            long secondsSinceLastSeen,
            int failureCount
    ) {
        public static DeviceView fromRecord(DeviceRecord record, DeviceStatus effectiveStatus, Instant now) {
            return new DeviceView(
                    record.getDeviceId(),
                    record.getDeviceType().getCode(),
                    record.getEndpoint().ipAddress(),
                    record.getEndpoint().port(),
                    effectiveStatus,
                    record.getCreatedAt(),
                    record.getLastSeen(),
                    record.silenceAt(now).getSeconds(),
                    record.getFailureCount()
            );
        }
    }
}
