package com.heronix.fleet.registry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

import com.heronix.fleet.model.domain.DeviceEndpoint;
import com.heronix.fleet.model.domain.DeviceRecord;
import com.heronix.fleet.model.dto.RegistryStatsDTO;
import com.heronix.fleet.model.enums.DeviceStatus;
import com.heronix.fleet.model.enums.DeviceType;

import lombok.extern.slf4j.Slf4j;

/**
 * Authoritative in-memory map of device id to registration state.
 *
 * One read/write lock guards the whole map. Every public method is one atomic
 * operation and never calls out of the process while holding the lock. Fleet
 * sizes are in the tens of devices, so a single lock domain is sufficient.
 *
 * Device ids are matched after trimming and ignoring case, so "cam-1" and
 * "CAM-1 " name the same device. The record keeps the spelling it was first
 * registered with.
 *
 * Records are immutable and replaced on every change; callers always receive
 * consistent snapshots.
 */
@Component
@Slf4j
public class DeviceRecordStore {

    private static final Comparator<DeviceRecord> BY_ID =
            Comparator.comparing(DeviceRecord::getDeviceId, String.CASE_INSENSITIVE_ORDER);

    private final Map<String, DeviceRecord> devices = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // ========================================================================
    // READS
    // ========================================================================

    public Optional<DeviceRecord> get(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(devices.get(key(deviceId)));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records matching the filter, ordered by device id.
     */
    public List<DeviceRecord> list(Predicate<DeviceRecord> filter) {
        lock.readLock().lock();
        try {
            return devices.values().stream()
                    .filter(filter)
                    .sorted(BY_ID)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return devices.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int countByType(DeviceType type) {
        lock.readLock().lock();
        try {
            return countByTypeLocked(type);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Counts by effective status and by type, taken under one lock acquisition.
     */
    public RegistryStatsDTO snapshotStats(Instant now, Duration inactiveThreshold, Map<String, Integer> typeLimits) {
        lock.readLock().lock();
        try {
            int active = 0;
            int inactive = 0;
            Map<String, Integer> byType = new TreeMap<>();

            for (DeviceRecord record : devices.values()) {
                if (record.effectiveStatus(now, inactiveThreshold) == DeviceStatus.ACTIVE) {
                    active++;
                } else {
                    inactive++;
                }
                byType.merge(record.getDeviceType().getCode(), 1, Integer::sum);
            }

            return RegistryStatsDTO.builder()
                    .totalDevices(devices.size())
                    .activeDevices(active)
                    .inactiveDevices(inactive)
                    .devicesByType(byType)
                    .deviceTypeLimits(new TreeMap<>(typeLimits))
                    .generatedAt(now)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // WRITES
    // ========================================================================

    /**
     * Create or refresh a registration.
     *
     * An unknown id is created when fewer than {@code limit} devices of its type
     * exist. A known id is refreshed only when the request comes from the
     * address already on file and names the same type; the refresh moves
     * last_seen forward, marks the device ACTIVE and clears its failure count.
     * Rejected calls leave the store unchanged.
     */
    public UpsertResult upsert(String deviceId, DeviceType type, DeviceEndpoint endpoint, int limit, Instant now) {
        String key = key(deviceId);

        lock.writeLock().lock();
        try {
            int count = countByTypeLocked(type);
            DeviceRecord existing = devices.get(key);

            if (existing == null) {
                if (count >= limit) {
                    return UpsertResult.capacityExceeded(count, limit);
                }
                DeviceRecord created = DeviceRecord.builder()
                        .deviceId(deviceId.trim())
                        .deviceType(type)
                        .endpoint(endpoint)
                        .status(DeviceStatus.ACTIVE)
                        .createdAt(now)
                        .lastSeen(now)
                        .failureCount(0)
                        .build();
                devices.put(key, created);
                return UpsertResult.created(created, count + 1, limit);
            }

            if (!existing.getEndpoint().ipAddress().equals(endpoint.ipAddress())) {
                return UpsertResult.identityConflict(existing, count, limit);
            }
            if (existing.getDeviceType() != type) {
                return UpsertResult.typeMismatch(existing, count, limit);
            }

            DeviceRecord refreshed = existing.toBuilder()
                    .endpoint(endpoint)
                    .status(DeviceStatus.ACTIVE)
                    .lastSeen(now.isAfter(existing.getLastSeen()) ? now : existing.getLastSeen())
                    .failureCount(0)
                    .build();
            devices.put(key, refreshed);
            return UpsertResult.updated(refreshed, count, limit);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the removed record, or empty when the id was unknown
     */
    public Optional<DeviceRecord> remove(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(devices.remove(key(deviceId)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the new failure count, or -1 when the device is no longer registered
     */
    public int incrementFailure(String deviceId) {
        lock.writeLock().lock();
        try {
            String key = key(deviceId);
            DeviceRecord existing = devices.get(key);
            if (existing == null) {
                return -1;
            }
            DeviceRecord updated = existing.toBuilder()
                    .failureCount(existing.getFailureCount() + 1)
                    .build();
            devices.put(key, updated);
            return updated.getFailureCount();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * One liveness pass: records silent for longer than {@code removalThreshold}
     * are deleted, records silent for longer than {@code inactiveThreshold} are
     * marked INACTIVE. Both happen under a single write lock.
     */
    public SweepOutcome sweep(Instant now, Duration inactiveThreshold, Duration removalThreshold) {
        lock.writeLock().lock();
        try {
            int before = devices.size();
            List<DeviceRecord> removed = new ArrayList<>();
            List<DeviceRecord> markedInactive = new ArrayList<>();

            Iterator<Map.Entry<String, DeviceRecord>> it = devices.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, DeviceRecord> entry = it.next();
                DeviceRecord record = entry.getValue();
                Duration silence = record.silenceAt(now);

                if (silence.compareTo(removalThreshold) > 0) {
                    it.remove();
                    removed.add(record);
                } else if (silence.compareTo(inactiveThreshold) > 0 && record.getStatus() != DeviceStatus.INACTIVE) {
                    DeviceRecord inactive = record.toBuilder().status(DeviceStatus.INACTIVE).build();
                    entry.setValue(inactive);
                    markedInactive.add(inactive);
                }
            }

            removed.sort(BY_ID);
            markedInactive.sort(BY_ID);
            return new SweepOutcome(List.copyOf(removed), List.copyOf(markedInactive), before);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop every record. Used for a full system reset.
     */
    public int clear() {
        lock.writeLock().lock();
        try {
            int count = devices.size();
            devices.clear();
            log.info("Registry cleared: removed {} devices", count);
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private int countByTypeLocked(DeviceType type) {
        int count = 0;
        for (DeviceRecord record : devices.values()) {
            if (record.getDeviceType() == type) {
                count++;
            }
        }
        return count;
    }

    private static String key(String deviceId) {
        return deviceId.trim().toLowerCase(Locale.ROOT);
    }
}
