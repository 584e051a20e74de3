package com.heronix.fleet.registry;

import java.util.List;

import com.heronix.fleet.model.domain.DeviceRecord;

/**
 * Result of one atomic liveness pass over the store.
 *
 * @param removed        records deleted because they passed the removal threshold
 * @param markedInactive records that changed from ACTIVE to INACTIVE in this pass
 * @param totalBefore    records held before the pass
 */
public record SweepOutcome(List<DeviceRecord> removed, List<DeviceRecord> markedInactive, int totalBefore) {

    public List<String> removedIds() {
        return removed.stream().map(DeviceRecord::getDeviceId).toList();
    }

    public int totalAfter() {
        return totalBefore - removed.size();
    }
}
