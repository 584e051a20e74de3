package com.heronix.fleet.heartbeat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.fleet.config.FleetProperties;
import com.heronix.fleet.exception.DeviceCommunicationException;
import com.heronix.fleet.exception.RegistrationRejectedException;
import com.heronix.fleet.model.dto.HeartbeatStatusDTO;
import com.heronix.fleet.model.enums.HeartbeatHealth;
import com.heronix.fleet.support.MutableClock;

class HeartbeatClientTest {

    private MutableClock clock;
    private FleetProperties properties;
    private ScriptedRegistrationClient controller;
    private HeartbeatClient heartbeatClient;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        properties = new FleetProperties();
        properties.getHeartbeat().setRetryDelaySeconds(0);
        controller = new ScriptedRegistrationClient();
        heartbeatClient = new HeartbeatClient(controller, properties, clock);
    }

    @Test
    void healthIsNeverSucceededBeforeFirstHeartbeat() {
        assertEquals(HeartbeatHealth.NEVER_SUCCEEDED, heartbeatClient.health());
        assertFalse(heartbeatClient.getStatus().isRunning());
    }

    @Test
    void acceptedHeartbeatSendsConfiguredRegistration() {
        assertTrue(heartbeatClient.forceHeartbeat());

        assertEquals("rear-camera-001", controller.lastDeviceId);
        assertEquals("rear-camera", controller.lastDeviceType);
        assertEquals("192.168.4.100", controller.lastIpAddress);
        assertEquals(5001, controller.lastPort);

        HeartbeatStatusDTO status = heartbeatClient.getStatus();
        assertEquals(1, status.getHeartbeatCount());
        assertEquals(0, status.getFailureCount());
        assertEquals(clock.instant(), status.getLastSuccess());
        assertEquals(HeartbeatHealth.HEALTHY, status.getHealth());
    }

    @Test
    void transientFailuresAreRetriedWithinOneHeartbeat() {
        controller.script(new DeviceCommunicationException("connection refused"),
                new DeviceCommunicationException("connection refused"));

        assertTrue(heartbeatClient.forceHeartbeat());

        assertEquals(3, controller.calls.get());
        HeartbeatStatusDTO status = heartbeatClient.getStatus();
        assertEquals(1, status.getHeartbeatCount());
        assertEquals(2, status.getFailureCount());
        assertEquals(HeartbeatHealth.HEALTHY, status.getHealth());
    }

    @Test
    void heartbeatGivesUpAfterConfiguredAttempts() {
        controller.alwaysFail(new DeviceCommunicationException("timeout"));

        assertFalse(heartbeatClient.forceHeartbeat());

        assertEquals(3, controller.calls.get());
        assertEquals(3, heartbeatClient.getStatus().getFailureCount());
        assertEquals(HeartbeatHealth.NEVER_SUCCEEDED, heartbeatClient.health());
    }

    @Test
    void rejectionIsNotRetried() {
        controller.alwaysFail(new RegistrationRejectedException(409, "limit exceeded"));

        assertFalse(heartbeatClient.forceHeartbeat());

        assertEquals(1, controller.calls.get());
        assertEquals(1, heartbeatClient.getStatus().getFailureCount());
    }

    @Test
    void healthDegradesThenTurnsUnhealthyAfterThreeIntervals() {
        heartbeatClient.forceHeartbeat();
        controller.alwaysFail(new DeviceCommunicationException("timeout"));

        clock.advanceSeconds(30);
        heartbeatClient.forceHeartbeat();
        assertEquals(HeartbeatHealth.DEGRADED, heartbeatClient.health());

        clock.advanceSeconds(60);
        assertEquals(HeartbeatHealth.DEGRADED, heartbeatClient.health());

        clock.advanceSeconds(1);
        assertEquals(HeartbeatHealth.UNHEALTHY, heartbeatClient.health());

        controller.succeed();
        heartbeatClient.forceHeartbeat();
        assertEquals(HeartbeatHealth.HEALTHY, heartbeatClient.health());
    }

    @Test
    void resetStatisticsClearsCountersAndTimestamps() {
        heartbeatClient.forceHeartbeat();

        heartbeatClient.resetStatistics();

        HeartbeatStatusDTO status = heartbeatClient.getStatus();
        assertEquals(0, status.getHeartbeatCount());
        assertEquals(0, status.getFailureCount());
        assertNull(status.getLastSuccess());
        assertNull(status.getLastFailure());
        assertEquals(HeartbeatHealth.NEVER_SUCCEEDED, status.getHealth());
    }

    @Test
    void updateIntervalValidatesAndApplies() {
        heartbeatClient.updateInterval(10);
        assertEquals(10, heartbeatClient.getStatus().getIntervalSeconds());

        assertThrows(IllegalArgumentException.class, () -> heartbeatClient.updateInterval(0));
        assertEquals(10, heartbeatClient.getStatus().getIntervalSeconds());
    }

    @Test
    void startSendsImmediatelyAndStopEndsTheLoop() throws Exception {
        CountDownLatch firstCall = new CountDownLatch(1);
        controller.onCall(firstCall::countDown);

        heartbeatClient.start();
        assertTrue(firstCall.await(5, TimeUnit.SECONDS));
        assertTrue(heartbeatClient.isRunning());

        heartbeatClient.stop();

        assertFalse(heartbeatClient.isRunning());
        int callsAtStop = controller.calls.get();
        Thread.sleep(100);
        assertEquals(callsAtStop, controller.calls.get());
    }

    @Test
    void stopInterruptsRetryWait() throws Exception {
        properties.getHeartbeat().setRetryDelaySeconds(30);
        HeartbeatClient slowRetries = new HeartbeatClient(controller, properties, clock);
        CountDownLatch firstCall = new CountDownLatch(1);
        controller.onCall(firstCall::countDown);
        controller.alwaysFail(new DeviceCommunicationException("timeout"));

        slowRetries.start();
        assertTrue(firstCall.await(5, TimeUnit.SECONDS));

        long started = System.nanoTime();
        slowRetries.stop();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(elapsedMillis < 5000, "stop took " + elapsedMillis + "ms");
        assertEquals(1, controller.calls.get());
        assertFalse(slowRetries.isRunning());
    }

    @Test
    void stopWaitsForManualHeartbeatInFlight() throws Exception {
        CountDownLatch firstCall = new CountDownLatch(1);
        controller.onCall(firstCall::countDown);
        heartbeatClient.start();
        assertTrue(firstCall.await(5, TimeUnit.SECONDS));

        CountDownLatch manualEntered = new CountDownLatch(1);
        CountDownLatch releaseManual = new CountDownLatch(1);
        AtomicBoolean inFlight = new AtomicBoolean();
        controller.onCall(() -> {
            inFlight.set(true);
            manualEntered.countDown();
            try {
                releaseManual.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.set(false);
        });

        Thread manual = new Thread(heartbeatClient::forceHeartbeat, "manual-heartbeat");
        manual.start();
        assertTrue(manualEntered.await(5, TimeUnit.SECONDS));

        Thread stopper = new Thread(heartbeatClient::stop, "heartbeat-stopper");
        stopper.start();
        stopper.join(300);
        assertTrue(stopper.isAlive(), "stop() returned while a manual heartbeat was in flight");

        int callsBefore = controller.calls.get();
        assertFalse(heartbeatClient.forceHeartbeat());
        assertEquals(callsBefore, controller.calls.get());

        releaseManual.countDown();
        stopper.join(5000);
        manual.join(5000);

        assertFalse(stopper.isAlive());
        assertFalse(inFlight.get());
        assertFalse(heartbeatClient.isRunning());
    }

    @Test
    void invalidConfigurationIsRejected() {
        properties.getHeartbeat().setRetryAttempts(0);

        assertThrows(IllegalArgumentException.class, () -> new HeartbeatClient(controller, properties, clock));
    }

    /**
     * Controller stand-in that replays scripted failures, then succeeds.
     */
    private static class ScriptedRegistrationClient implements ControllerRegistrationClient {

        private final Deque<Exception> script = new ArrayDeque<>();
        private final AtomicInteger calls = new AtomicInteger();
        private volatile Exception permanentFailure;
        private volatile Runnable onCall = () -> { };

        private volatile String lastDeviceId;
        private volatile String lastDeviceType;
        private volatile String lastIpAddress;
        private volatile int lastPort;

        synchronized void script(Exception... failures) {
            script.addAll(List.of(failures));
        }

        void alwaysFail(Exception failure) {
            permanentFailure = failure;
        }

        void succeed() {
            permanentFailure = null;
        }

        void onCall(Runnable callback) {
            onCall = callback;
        }

        @Override
        public void register(String deviceId, String deviceType, String ipAddress, int port)
                throws DeviceCommunicationException {
            calls.incrementAndGet();
            lastDeviceId = deviceId;
            lastDeviceType = deviceType;
            lastIpAddress = ipAddress;
            lastPort = port;
            onCall.run();

            Exception failure = nextFailure();
            if (failure instanceof DeviceCommunicationException communication) {
                throw communication;
            }
            if (failure instanceof RuntimeException runtime) {
                throw runtime;
            }
        }

        private synchronized Exception nextFailure() {
            if (!script.isEmpty()) {
                return script.poll();
            }
            return permanentFailure;
        }
    }
}
