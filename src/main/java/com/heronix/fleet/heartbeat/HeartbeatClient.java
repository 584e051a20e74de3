package com.heronix.fleet.heartbeat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import com.heronix.fleet.config.FleetProperties;
import com.heronix.fleet.exception.DeviceCommunicationException;
import com.heronix.fleet.exception.RegistrationRejectedException;
import com.heronix.fleet.model.dto.HeartbeatStatusDTO;
import com.heronix.fleet.model.enums.HeartbeatHealth;

import lombok.extern.slf4j.Slf4j;

/**
 * Device-side agent that keeps this device registered with the main controller.
 *
 * Every interval the agent sends one registration. A transport failure or a
 * controller-side error is retried a fixed number of times with a fixed delay;
 * a rejection (4xx) ends the attempt immediately. After the last attempt the
 * agent waits for the next interval.
 *
 * {@link #stop()} wakes the loop whether it is waiting for the next interval or
 * for a retry, then waits for the loop thread and for any manual heartbeat to
 * finish. When it returns no heartbeat is in flight. Manual heartbeats are
 * refused while a stop is in progress.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Component
@ConditionalOnProperty(name = "heronix.fleet.heartbeat.enabled", havingValue = "true")
@Slf4j
public class HeartbeatClient implements SmartLifecycle {

    private final ControllerRegistrationClient controllerClient;
    private final FleetProperties.HeartbeatConfig config;
    private final Clock clock;

    private final Object lifecycleMonitor = new Object();
    private ExecutorService executor;
    private Future<?> loopTask;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);

    // manual heartbeats hold the read side; stop() drains them through the write side
    private final ReentrantReadWriteLock sendGate = new ReentrantReadWriteLock();
    private volatile boolean stopping;

    private volatile long intervalSeconds;

    private final AtomicLong heartbeatCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private volatile Instant lastSuccess;
    private volatile Instant lastFailure;
    private volatile boolean lastAttemptSucceeded;

    public HeartbeatClient(ControllerRegistrationClient controllerClient, FleetProperties properties, Clock clock) {
        this.controllerClient = controllerClient;
        this.config = properties.getHeartbeat();
        this.clock = clock;
        if (config.getIntervalSeconds() <= 0) {
            throw new IllegalArgumentException("Heartbeat interval must be positive");
        }
        if (config.getRetryAttempts() < 1) {
            throw new IllegalArgumentException("Heartbeat retry attempts must be at least 1");
        }
        this.intervalSeconds = config.getIntervalSeconds();
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (loopTask != null) {
                log.warn("Heartbeat service is already running");
                return;
            }
            CountDownLatch signal = new CountDownLatch(1);
            stopSignal = signal;
            executor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("heartbeat-"));
            loopTask = executor.submit(() -> heartbeatLoop(signal));
            log.info("Heartbeat service started for {} with {}s interval", config.getDeviceId(), intervalSeconds);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (loopTask == null) {
                log.warn("Heartbeat service is not running");
                return;
            }
            stopping = true;
            stopSignal.countDown();
            long stopTimeout = config.getStopTimeoutSeconds();
            try {
                loopTask.get(stopTimeout, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("Heartbeat loop did not stop within {}s, interrupting", stopTimeout);
                loopTask.cancel(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                loopTask.cancel(true);
            } catch (ExecutionException e) {
                log.error("Heartbeat loop ended with an error: {}", e.getCause().getMessage(), e.getCause());
            } finally {
                executor.shutdownNow();
                awaitTermination(executor, stopTimeout);
                drainManualHeartbeats(stopTimeout);
                executor = null;
                loopTask = null;
                stopping = false;
            }
            log.info("Heartbeat service stopped");
        }
    }

    @Override
    public boolean isRunning() {
        synchronized (lifecycleMonitor) {
            return loopTask != null;
        }
    }

    // ========================================================================
    // HEARTBEAT
    // ========================================================================

    /**
     * Send one heartbeat now, outside the schedule, with the usual retries.
     *
     * @return true when the controller accepted it; false when it failed or
     *         the service is stopping
     */
    public boolean forceHeartbeat() {
        Lock gate = sendGate.readLock();
        if (stopping || !gate.tryLock()) {
            log.warn("Manual heartbeat refused, heartbeat service is stopping");
            return false;
        }
        try {
            CountDownLatch signal = stopSignal;
            boolean running = signal.getCount() > 0;
            // checked after the latch: a stop that already fired has set the flag
            if (stopping) {
                log.warn("Manual heartbeat refused, heartbeat service is stopping");
                return false;
            }
            log.info("Manual heartbeat triggered");
            return sendHeartbeat(running ? signal : new CountDownLatch(1));
        } finally {
            gate.unlock();
        }
    }

    /**
     * Change the interval; applied from the next interval boundary.
     */
    public void updateInterval(long newIntervalSeconds) {
        if (newIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Heartbeat interval must be positive");
        }
        long old = intervalSeconds;
        intervalSeconds = newIntervalSeconds;
        log.info("Heartbeat interval updated from {}s to {}s", old, newIntervalSeconds);
    }

    public void resetStatistics() {
        heartbeatCount.set(0);
        failureCount.set(0);
        lastSuccess = null;
        lastFailure = null;
        lastAttemptSucceeded = false;
        log.info("Heartbeat statistics reset");
    }

    public HeartbeatStatusDTO getStatus() {
        return HeartbeatStatusDTO.builder()
                .deviceId(config.getDeviceId())
                .deviceType(config.getDeviceType())
                .running(isRunning())
                .intervalSeconds(intervalSeconds)
                .retryAttempts(config.getRetryAttempts())
                .retryDelaySeconds(config.getRetryDelaySeconds())
                .heartbeatCount(heartbeatCount.get())
                .failureCount(failureCount.get())
                .lastSuccess(lastSuccess)
                .lastFailure(lastFailure)
                .health(health())
                .build();
    }

    /**
     * Health derived from the success and failure history.
     */
    public HeartbeatHealth health() {
        Instant success = lastSuccess;
        Instant failure = lastFailure;

        if (success == null) {
            return HeartbeatHealth.NEVER_SUCCEEDED;
        }
        if (failure == null || success.isAfter(failure) || (success.equals(failure) && lastAttemptSucceeded)) {
            return HeartbeatHealth.HEALTHY;
        }
        Duration sinceSuccess = Duration.between(success, clock.instant());
        if (sinceSuccess.compareTo(Duration.ofSeconds(intervalSeconds * 3)) > 0) {
            return HeartbeatHealth.UNHEALTHY;
        }
        return HeartbeatHealth.DEGRADED;
    }

    // ========================================================================
    // LOOP
    // ========================================================================

    private void heartbeatLoop(CountDownLatch signal) {
        while (signal.getCount() > 0) {
            try {
                sendHeartbeat(signal);
            } catch (RuntimeException e) {
                log.error("Unexpected error in heartbeat loop: {}", e.getMessage(), e);
            }
            if (await(signal, Duration.ofSeconds(intervalSeconds))) {
                return;
            }
        }
    }

    /**
     * One heartbeat with retries.
     */
    boolean sendHeartbeat(CountDownLatch signal) {
        int attempts = config.getRetryAttempts();

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                controllerClient.register(config.getDeviceId(), config.getDeviceType(),
                        config.getAdvertisedAddress(), config.getPort());
                recordSuccess();
                log.debug("Heartbeat accepted for {} (attempt {}, total {})",
                        config.getDeviceId(), attempt, heartbeatCount.get());
                return true;

            } catch (RegistrationRejectedException e) {
                recordFailure();
                log.error("Heartbeat rejected for {}: {}", config.getDeviceId(), e.getMessage());
                return false;

            } catch (DeviceCommunicationException e) {
                recordFailure();
                log.warn("Heartbeat attempt {}/{} failed for {}: {}",
                        attempt, attempts, config.getDeviceId(), e.getMessage());
                if (attempt == attempts) {
                    log.error("Heartbeat failed after {} attempts for {}", attempts, config.getDeviceId());
                    return false;
                }
                if (await(signal, Duration.ofSeconds(config.getRetryDelaySeconds()))) {
                    return false;
                }

            } catch (RuntimeException e) {
                recordFailure();
                log.error("Unexpected error during heartbeat: {}", e.getMessage(), e);
                return false;
            }
        }
        return false;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void recordSuccess() {
        heartbeatCount.incrementAndGet();
        lastSuccess = clock.instant();
        lastAttemptSucceeded = true;
    }

    private void recordFailure() {
        failureCount.incrementAndGet();
        lastFailure = clock.instant();
        lastAttemptSucceeded = false;
    }

    /**
     * @return true when stop was requested (or the thread was interrupted)
     */
    private static boolean await(CountDownLatch signal, Duration duration) {
        try {
            return signal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void drainManualHeartbeats(long seconds) {
        Lock gate = sendGate.writeLock();
        try {
            if (gate.tryLock(seconds, TimeUnit.SECONDS)) {
                gate.unlock();
            } else {
                log.warn("Manual heartbeat still in flight after {}s", seconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitTermination(ExecutorService executor, long seconds) {
        try {
            if (!executor.awaitTermination(seconds, TimeUnit.SECONDS)) {
                log.warn("Heartbeat thread still alive after {}s", seconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
