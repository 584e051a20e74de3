package com.heronix.fleet.controller.api;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import com.heronix.fleet.model.enums.FleetErrorKind;

import lombok.RequiredArgsConstructor;

/**
 * Builds the {@code {error, error_type, status: "error"}} bodies shared by the REST API.
 */
@Component
@RequiredArgsConstructor
class ErrorResponses {

    private final Clock clock;

    ResponseEntity<Map<String, Object>> error(FleetErrorKind kind, String message) {
        return ResponseEntity.status(kind.getHttpStatus()).body(body(kind, message));
    }

    ResponseEntity<Map<String, Object>> notFound(String message) {
        return error(FleetErrorKind.NOT_FOUND, message);
    }

    /**
     * Rejects a non-positive interval query parameter.
     */
    ResponseEntity<Map<String, Object>> invalidInterval(long intervalSeconds) {
        return error(FleetErrorKind.VALIDATION_ERROR,
                "interval_seconds must be positive, got " + intervalSeconds);
    }

    Map<String, Object> body(FleetErrorKind kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("error_type", kind.getCode());
        body.put("status", "error");
        body.put("timestamp", clock.instant());
        return body;
    }
}
