package com.heronix.fleet.registry;

import com.heronix.fleet.model.domain.DeviceRecord;

/**
 * Outcome of {@link DeviceRecordStore#upsert}.
 *
 * @param kind         what the store did
 * @param record       the stored record after the call (the untouched existing
 *                     record on a conflict, null when capacity was exceeded)
 * @param currentCount devices of the requested type at decision time
 * @param limit        population limit applied to the requested type
 */
public record UpsertResult(Kind kind, DeviceRecord record, int currentCount, int limit) {

    public enum Kind {
        CREATED,
        UPDATED,
        CAPACITY_EXCEEDED,
        IDENTITY_CONFLICT,
        TYPE_MISMATCH
    }

    public static UpsertResult created(DeviceRecord record, int currentCount, int limit) {
        return new UpsertResult(Kind.CREATED, record, currentCount, limit);
    }

    public static UpsertResult updated(DeviceRecord record, int currentCount, int limit) {
        return new UpsertResult(Kind.UPDATED, record, currentCount, limit);
    }

    public static UpsertResult capacityExceeded(int currentCount, int limit) {
        return new UpsertResult(Kind.CAPACITY_EXCEEDED, null, currentCount, limit);
    }

    public static UpsertResult identityConflict(DeviceRecord existing, int currentCount, int limit) {
        return new UpsertResult(Kind.IDENTITY_CONFLICT, existing, currentCount, limit);
    }

    public static UpsertResult typeMismatch(DeviceRecord existing, int currentCount, int limit) {
        return new UpsertResult(Kind.TYPE_MISMATCH, existing, currentCount, limit);
    }

    public boolean applied() {
        return kind == Kind.CREATED || kind == Kind.UPDATED;
    }
}
