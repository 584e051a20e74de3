package com.heronix.fleet.heartbeat;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.heronix.fleet.config.FleetProperties;
import com.heronix.fleet.controller.api.DeviceRegistryController;
import com.heronix.fleet.exception.DeviceCommunicationException;
import com.heronix.fleet.exception.RegistrationRejectedException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

/**
 * Calls {@code PUT {controller}/api/v1/main-controller/device/{id}} with WebClient.
 */
@Component
@ConditionalOnProperty(name = "heronix.fleet.heartbeat.enabled", havingValue = "true")
@Slf4j
public class WebClientControllerRegistrationClient implements ControllerRegistrationClient {

    private final WebClient client;
    private final Duration timeout;

    public WebClientControllerRegistrationClient(WebClient.Builder webClientBuilder, FleetProperties properties) {
        FleetProperties.HeartbeatConfig config = properties.getHeartbeat();
        this.client = webClientBuilder.clone()
                .baseUrl(config.getControllerUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.timeout = Duration.ofSeconds(config.getRequestTimeoutSeconds());
    }

    @Override
    public void register(String deviceId, String deviceType, String ipAddress, int port)
            throws DeviceCommunicationException {
        Map<String, Object> registration = Map.of(
                "device_type", deviceType,
                "ip_address", ipAddress,
                "port", port
        );

        Outcome outcome;
        try {
            outcome = client.put()
                    .uri(DeviceRegistryController.BASE_PATH + "/device/{id}", deviceId)
                    .bodyValue(registration)
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new Outcome(response.statusCode().value(), body)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String reason = cause instanceof TimeoutException
                    ? "Request timeout to main controller"
                    : "Failed to communicate with main controller: " + cause.getMessage();
            throw new DeviceCommunicationException(reason, cause);
        }

        if (outcome == null) {
            throw new DeviceCommunicationException("Empty response from main controller");
        }
        if (outcome.status() >= 200 && outcome.status() < 300) {
            log.debug("Registration of {} accepted", deviceId);
            return;
        }

        String message = "Registration failed with status " + outcome.status()
                + (outcome.body().isEmpty() ? "" : ": " + outcome.body());
        if (outcome.status() >= 400 && outcome.status() < 500) {
            throw new RegistrationRejectedException(outcome.status(), message);
        }
        throw new DeviceCommunicationException(message);
    }

    private record Outcome(int status, String body) {
    }
}
