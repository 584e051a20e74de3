package com.heronix.fleet.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.fleet.model.domain.DeviceEndpoint;
import com.heronix.fleet.model.domain.DeviceRecord;
import com.heronix.fleet.model.dto.RegistryStatsDTO;
import com.heronix.fleet.model.enums.DeviceStatus;
import com.heronix.fleet.model.enums.DeviceType;

/**
 * Locks down the atomic operations of the in-memory device store.
 */
class DeviceRecordStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration INACTIVE = Duration.ofSeconds(120);
    private static final Duration REMOVAL = Duration.ofSeconds(300);
    private static final DeviceEndpoint CAM_ADDRESS = new DeviceEndpoint("192.168.4.100", 5001);

    private DeviceRecordStore store;

    @BeforeEach
    void setUp() {
        store = new DeviceRecordStore();
    }

    @Test
    void upsertCreatesActiveRecordForUnknownId() {
        UpsertResult result = store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);

        assertEquals(UpsertResult.Kind.CREATED, result.kind());
        assertTrue(result.applied());
        DeviceRecord record = result.record();
        assertEquals("cam-1", record.getDeviceId());
        assertEquals(DeviceStatus.ACTIVE, record.getStatus());
        assertEquals(T0, record.getCreatedAt());
        assertEquals(T0, record.getLastSeen());
        assertEquals(0, record.getFailureCount());
        assertEquals(1, store.size());
    }

    @Test
    void upsertRejectsNewIdWhenTypeIsAtCapacity() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);

        UpsertResult result = store.upsert("cam-2", DeviceType.REAR_CAMERA,
                new DeviceEndpoint("192.168.4.101", 5001), 1, T0);

        assertEquals(UpsertResult.Kind.CAPACITY_EXCEEDED, result.kind());
        assertFalse(result.applied());
        assertNull(result.record());
        assertEquals(1, result.currentCount());
        assertEquals(1, result.limit());
        assertTrue(store.get("cam-2").isEmpty());
    }

    @Test
    void heartbeatFromSameAddressRefreshesRecord() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);
        store.incrementFailure("cam-1");
        store.sweep(T0.plusSeconds(121), INACTIVE, REMOVAL);

        UpsertResult result = store.upsert("cam-1", DeviceType.REAR_CAMERA,
                new DeviceEndpoint("192.168.4.100", 6000), 1, T0.plusSeconds(150));

        assertEquals(UpsertResult.Kind.UPDATED, result.kind());
        DeviceRecord record = result.record();
        assertEquals(DeviceStatus.ACTIVE, record.getStatus());
        assertEquals(T0, record.getCreatedAt());
        assertEquals(T0.plusSeconds(150), record.getLastSeen());
        assertEquals(0, record.getFailureCount());
        assertEquals(6000, record.getEndpoint().port());
    }

    @Test
    void heartbeatNeverMovesLastSeenBackwards() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0.plusSeconds(10));

        DeviceRecord record = store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0).record();

        assertEquals(T0.plusSeconds(10), record.getLastSeen());
    }

    @Test
    void upsertFromDifferentAddressIsIdentityConflict() {
        DeviceRecord original = store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0).record();

        UpsertResult result = store.upsert("cam-1", DeviceType.REAR_CAMERA,
                new DeviceEndpoint("192.168.4.200", 5001), 1, T0.plusSeconds(5));

        assertEquals(UpsertResult.Kind.IDENTITY_CONFLICT, result.kind());
        assertSame(original, store.get("cam-1").orElseThrow());
    }

    @Test
    void idsAreMatchedTrimmedAndCaseInsensitive() {
        store.upsert("Cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);

        UpsertResult result = store.upsert(" cam-1 ", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0.plusSeconds(1));

        assertEquals(UpsertResult.Kind.UPDATED, result.kind());
        assertEquals("Cam-1", result.record().getDeviceId());
        assertTrue(store.get("CAM-1").isPresent());
        assertEquals(1, store.size());
    }

    @Test
    void removeReturnsRecordOnceThenEmpty() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);

        assertTrue(store.remove("cam-1").isPresent());
        assertTrue(store.remove("cam-1").isEmpty());
        assertTrue(store.remove(null).isEmpty());
    }

    @Test
    void incrementFailureCountsUpAndReportsMissingDevice() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);

        assertEquals(1, store.incrementFailure("cam-1"));
        assertEquals(2, store.incrementFailure("cam-1"));
        assertEquals(-1, store.incrementFailure("cam-9"));
        assertEquals(2, store.get("cam-1").orElseThrow().getFailureCount());
    }

    @Test
    void sweepMarksInactiveAfterThresholdOnlyOnce() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);

        SweepOutcome atThreshold = store.sweep(T0.plusSeconds(120), INACTIVE, REMOVAL);
        assertTrue(atThreshold.markedInactive().isEmpty());

        SweepOutcome past = store.sweep(T0.plusSeconds(121), INACTIVE, REMOVAL);
        assertEquals(List.of("cam-1"), past.markedInactive().stream().map(DeviceRecord::getDeviceId).toList());
        assertEquals(DeviceStatus.INACTIVE, store.get("cam-1").orElseThrow().getStatus());

        SweepOutcome again = store.sweep(T0.plusSeconds(200), INACTIVE, REMOVAL);
        assertTrue(again.markedInactive().isEmpty());
        assertTrue(again.removed().isEmpty());
    }

    @Test
    void sweepRemovesRecordsPastRemovalThreshold() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);

        SweepOutcome outcome = store.sweep(T0.plusSeconds(301), INACTIVE, REMOVAL);

        assertEquals(List.of("cam-1"), outcome.removedIds());
        assertEquals(1, outcome.totalBefore());
        assertEquals(0, outcome.totalAfter());
        assertTrue(store.get("cam-1").isEmpty());
        assertTrue(store.sweep(T0.plusSeconds(302), INACTIVE, REMOVAL).removedIds().isEmpty());
    }

    @Test
    void listFiltersByEffectiveStatusAndOrdersById() {
        store.upsert("cam-b", DeviceType.REAR_CAMERA, new DeviceEndpoint("10.0.0.2", 5001), 3, T0);
        store.upsert("cam-a", DeviceType.REAR_CAMERA, new DeviceEndpoint("10.0.0.1", 5001), 3, T0.plusSeconds(100));
        store.upsert("cam-c", DeviceType.REAR_CAMERA, new DeviceEndpoint("10.0.0.3", 5001), 3, T0.plusSeconds(100));

        Instant now = T0.plusSeconds(130);

        List<String> all = store.list(DeviceFilter.all()).stream().map(DeviceRecord::getDeviceId).toList();
        assertEquals(List.of("cam-a", "cam-b", "cam-c"), all);

        List<String> active = store.list(new DeviceFilter(null, true, now, INACTIVE)).stream()
                .map(DeviceRecord::getDeviceId).toList();
        assertEquals(List.of("cam-a", "cam-c"), active);
    }

    @Test
    void snapshotStatsUsesEffectiveStatus() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, new DeviceEndpoint("10.0.0.1", 5001), 2, T0);
        store.upsert("cam-2", DeviceType.REAR_CAMERA, new DeviceEndpoint("10.0.0.2", 5001), 2, T0.plusSeconds(60));

        RegistryStatsDTO stats = store.snapshotStats(T0.plusSeconds(150), INACTIVE, Map.of("rear-camera", 2));

        assertEquals(2, stats.getTotalDevices());
        assertEquals(1, stats.getActiveDevices());
        assertEquals(1, stats.getInactiveDevices());
        assertEquals(Map.of("rear-camera", 2), stats.getDevicesByType());
        assertEquals(Map.of("rear-camera", 2), stats.getDeviceTypeLimits());
    }

    @Test
    void clearDropsEverything() {
        store.upsert("cam-1", DeviceType.REAR_CAMERA, CAM_ADDRESS, 1, T0);

        assertEquals(1, store.clear());
        assertEquals(0, store.size());
        assertEquals(0, store.countByType(DeviceType.REAR_CAMERA));
    }

    @Test
    void concurrentRegistrationsNeverExceedLimit() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<UpsertResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String id = "cam-" + i;
                DeviceEndpoint endpoint = new DeviceEndpoint("10.0.0." + (i + 1), 5001);
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.upsert(id, DeviceType.REAR_CAMERA, endpoint, 3, T0);
                }));
            }
            start.countDown();

            int created = 0;
            for (Future<UpsertResult> future : futures) {
                if (future.get(5, TimeUnit.SECONDS).kind() == UpsertResult.Kind.CREATED) {
                    created++;
                }
            }
            assertEquals(3, created);
            assertEquals(3, store.countByType(DeviceType.REAR_CAMERA));
        } finally {
            pool.shutdownNow();
        }
    }
}
