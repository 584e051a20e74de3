package com.heronix.fleet.heartbeat;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.fleet.config.FleetProperties;
import com.heronix.fleet.exception.DeviceCommunicationException;
import com.heronix.fleet.exception.RegistrationRejectedException;
import com.sun.net.httpserver.HttpServer;

/**
 * Runs the registration client against a local HTTP server standing in for
 * the main controller.
 */
class WebClientControllerRegistrationClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> path = new AtomicReference<>();
    private final AtomicReference<String> method = new AtomicReference<>();
    private final AtomicReference<String> body = new AtomicReference<>();

    private HttpServer mainController;
    private WebClientControllerRegistrationClient client;

    @BeforeEach
    void startController() throws IOException {
        mainController = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        mainController.createContext("/", exchange -> {
            method.set(exchange.getRequestMethod());
            path.set(exchange.getRequestURI().getPath());
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] answer = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), answer.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(answer);
            }
        });
        mainController.start();

        FleetProperties properties = new FleetProperties();
        properties.getHeartbeat().setControllerUrl("http://127.0.0.1:" + mainController.getAddress().getPort());
        properties.getHeartbeat().setRequestTimeoutSeconds(2);
        client = new WebClientControllerRegistrationClient(WebClient.builder(), properties);
    }

    @AfterEach
    void stopController() {
        mainController.stop(0);
    }

    @Test
    void registersWithSnakeCaseBody() throws Exception {
        assertDoesNotThrow(() -> client.register("rear-camera-001", "rear-camera", "192.168.4.100", 5001));

        assertEquals("PUT", method.get());
        assertEquals("/api/v1/main-controller/device/rear-camera-001", path.get());
        JsonNode sent = objectMapper.readTree(body.get());
        assertEquals("rear-camera", sent.get("device_type").asText());
        assertEquals("192.168.4.100", sent.get("ip_address").asText());
        assertEquals(5001, sent.get("port").asInt());
    }

    @Test
    void clientErrorIsRejection() {
        status.set(409);

        RegistrationRejectedException e = assertThrows(RegistrationRejectedException.class,
                () -> client.register("rear-camera-001", "rear-camera", "192.168.4.100", 5001));

        assertEquals(409, e.getStatusCode());
    }

    @Test
    void serverErrorIsRetryableCommunicationFailure() {
        status.set(503);

        DeviceCommunicationException e = assertThrows(DeviceCommunicationException.class,
                () -> client.register("rear-camera-001", "rear-camera", "192.168.4.100", 5001));

        assertTrue(e.getMessage().contains("503"), e.getMessage());
    }

    @Test
    void unreachableControllerIsCommunicationFailure() throws IOException {
        HttpServer released = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int closedPort = released.getAddress().getPort();
        released.stop(0);
        FleetProperties properties = new FleetProperties();
        properties.getHeartbeat().setControllerUrl("http://127.0.0.1:" + closedPort);
        WebClientControllerRegistrationClient offline =
                new WebClientControllerRegistrationClient(WebClient.builder(), properties);

        assertThrows(DeviceCommunicationException.class,
                () -> offline.register("rear-camera-001", "rear-camera", "192.168.4.100", 5001));
    }
}
