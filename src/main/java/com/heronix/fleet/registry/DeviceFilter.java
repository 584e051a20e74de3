package com.heronix.fleet.registry;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;

import com.heronix.fleet.model.domain.DeviceRecord;
import com.heronix.fleet.model.enums.DeviceStatus;
import com.heronix.fleet.model.enums.DeviceType;

/**
 * Selection criteria for {@link DeviceRecordStore#list}.
 *
 * @param deviceType        only this type, or any type when null
 * @param activeOnly        only devices whose effective status is ACTIVE
 * @param now               instant the effective status is evaluated at
 * @param inactiveThreshold silence after which a device counts as inactive
 */
public record DeviceFilter(DeviceType deviceType, boolean activeOnly, Instant now, Duration inactiveThreshold)
        implements Predicate<DeviceRecord> {

    public static DeviceFilter all() {
        return new DeviceFilter(null, false, null, null);
    }

    @Override
    public boolean test(DeviceRecord record) {
        if (deviceType != null && record.getDeviceType() != deviceType) {
            return false;
        }
        return !activeOnly || record.effectiveStatus(now, inactiveThreshold) == DeviceStatus.ACTIVE;
    }
}
