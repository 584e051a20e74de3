package com.heronix.fleet.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import com.heronix.fleet.config.FleetProperties;
import com.heronix.fleet.event.DeviceLifecycleEvent;
import com.heronix.fleet.model.domain.DeviceRecord;
import com.heronix.fleet.model.dto.SweeperStatusDTO;
import com.heronix.fleet.model.enums.DeviceEventType;
import com.heronix.fleet.registry.DeviceRecordStore;
import com.heronix.fleet.registry.SweepOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodically ages silent devices: marks them inactive past the inactive
 * threshold and removes them past the removal threshold.
 *
 * The sweep is one cancellable fixed-delay task on a dedicated scheduler,
 * started and stopped with the application context. {@link #forceSweep()} runs
 * the same pass on the caller's thread.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@Slf4j
public class LivenessSweeper implements SmartLifecycle {

    private final DeviceRecordStore store;
    private final FleetProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final TaskScheduler taskScheduler;

    private final Object lifecycleMonitor = new Object();
    private ScheduledFuture<?> scheduledTask;
    private long intervalSeconds;

    private volatile Instant lastRunAt;
    private volatile Instant scheduledFrom;
    private volatile Instant lastScheduledRunAt;
    private volatile int lastRemovedCount;
    private final AtomicLong failedRuns = new AtomicLong();

    public LivenessSweeper(DeviceRecordStore store,
                           FleetProperties properties,
                           ApplicationEventPublisher eventPublisher,
                           Clock clock,
                           @Qualifier("livenessTaskScheduler") TaskScheduler taskScheduler) {
        FleetProperties.LivenessConfig liveness = properties.getLiveness();
        if (liveness.getRemovalThresholdSeconds() <= liveness.getInactiveThresholdSeconds()) {
            throw new IllegalArgumentException("Removal threshold (" + liveness.getRemovalThresholdSeconds()
                    + "s) must be greater than inactive threshold (" + liveness.getInactiveThresholdSeconds() + "s)");
        }
        if (liveness.getSweepIntervalSeconds() <= 0) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
        this.store = store;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.taskScheduler = taskScheduler;
        this.intervalSeconds = liveness.getSweepIntervalSeconds();
    }

    // ========================================================================
    // SWEEP
    // ========================================================================

    /**
     * Run one pass now.
     *
     * @return ids of the removed devices
     */
    public List<String> sweep() {
        Instant now = clock.instant();
        lastRunAt = now;

        SweepOutcome outcome = store.sweep(now, inactiveThreshold(), removalThreshold());

        for (DeviceRecord record : outcome.markedInactive()) {
            publish(DeviceEventType.MARKED_INACTIVE, record, now);
        }
        for (DeviceRecord record : outcome.removed()) {
            publish(DeviceEventType.REMOVED_STALE, record, now);
        }

        lastRemovedCount = outcome.removed().size();
        if (!outcome.removed().isEmpty() || !outcome.markedInactive().isEmpty()) {
            log.info("Sweep completed: {} marked inactive, {} removed, devices {} -> {}",
                    outcome.markedInactive().size(), outcome.removed().size(),
                    outcome.totalBefore(), outcome.totalAfter());
        } else {
            log.debug("Sweep completed: nothing to do ({} devices)", outcome.totalBefore());
        }
        return outcome.removedIds();
    }

    /**
     * On-demand sweep; same result a scheduled tick would produce at this instant.
     */
    public List<String> forceSweep() {
        log.info("Manual sweep triggered");
        return sweep();
    }

    /**
     * Scheduled entry point. Errors are logged and the next tick runs as usual.
     */
    void scheduledSweep() {
        lastScheduledRunAt = clock.instant();
        try {
            sweep();
        } catch (RuntimeException e) {
            failedRuns.incrementAndGet();
            log.error("Error during scheduled sweep: {}", e.getMessage(), e);
        }
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (scheduledTask != null) {
                log.warn("Liveness sweeper is already running");
                return;
            }
            schedule(intervalSeconds);
            log.info("Liveness sweeper started: interval={}s inactive={}s removal={}s",
                    intervalSeconds, properties.getLiveness().getInactiveThresholdSeconds(),
                    properties.getLiveness().getRemovalThresholdSeconds());
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (scheduledTask == null) {
                return;
            }
            scheduledTask.cancel(false);
            scheduledTask = null;
            scheduledFrom = null;
            log.info("Liveness sweeper stopped");
        }
    }

    @Override
    public boolean isRunning() {
        synchronized (lifecycleMonitor) {
            return scheduledTask != null;
        }
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getLiveness().isEnabled();
    }

    /**
     * Change the sweep interval. A running sweeper is rescheduled with the new
     * interval; the next tick happens one full new interval from now.
     */
    public void updateInterval(long newIntervalSeconds) {
        if (newIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
        synchronized (lifecycleMonitor) {
            long oldInterval = intervalSeconds;
            intervalSeconds = newIntervalSeconds;
            if (scheduledTask != null) {
                scheduledTask.cancel(false);
                schedule(newIntervalSeconds);
            }
            log.info("Sweep interval updated from {}s to {}s{}", oldInterval, newIntervalSeconds,
                    scheduledTask == null ? " (sweeper not running)" : "");
        }
    }

    public SweeperStatusDTO getStatus() {
        synchronized (lifecycleMonitor) {
            Instant nextRunAt = null;
            if (scheduledTask != null) {
                Instant tick = lastScheduledRunAt;
                Instant base = tick != null && tick.isAfter(scheduledFrom) ? tick : scheduledFrom;
                nextRunAt = base.plusSeconds(intervalSeconds);
            }
            return SweeperStatusDTO.builder()
                    .running(scheduledTask != null)
                    .intervalSeconds(intervalSeconds)
                    .inactiveThresholdSeconds(properties.getLiveness().getInactiveThresholdSeconds())
                    .removalThresholdSeconds(properties.getLiveness().getRemovalThresholdSeconds())
                    .lastRunAt(lastRunAt)
                    .lastRemovedCount(lastRemovedCount)
                    .nextRunAt(nextRunAt)
                    .failedRuns(failedRuns.get())
                    .build();
        }
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void schedule(long seconds) {
        scheduledFrom = clock.instant();
        scheduledTask = taskScheduler.scheduleWithFixedDelay(this::scheduledSweep,
                taskScheduler.getClock().instant().plusSeconds(seconds), Duration.ofSeconds(seconds));
    }

    private Duration inactiveThreshold() {
        return Duration.ofSeconds(properties.getLiveness().getInactiveThresholdSeconds());
    }

    private Duration removalThreshold() {
        return Duration.ofSeconds(properties.getLiveness().getRemovalThresholdSeconds());
    }

    private void publish(DeviceEventType type, DeviceRecord record, Instant now) {
        eventPublisher.publishEvent(new DeviceLifecycleEvent(type, record.getDeviceId(), record.getDeviceType(), now,
                Map.of("last_seen", record.getLastSeen().toString(),
                        "silence_seconds", record.silenceAt(now).getSeconds())));
    }
}
