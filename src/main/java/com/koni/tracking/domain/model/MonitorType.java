package com.koni.tracking.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Kinds of violation checks an object can be monitored for.
 * The codes are bits of the object's {@code monitor_type} bitmask and are also
 * stored as the monitor type of a violation event.
 */
@Getter
@RequiredArgsConstructor
public enum MonitorType {

    GEO_FENCE(1),
    PANIC(2),
    MOVEMENT(4),
    LOCATION(8);

    private final int code;

    /**
     * Checks whether a monitor-type bitmask selects this check.
     *
     * @param bitmask the object's monitor-type bitmask
     * @return true if the bit of this type is set
     */
    public boolean isSelectedBy(int bitmask) {
        return (bitmask & code) == code;
    }

    public static MonitorType fromCode(int code) {
        return Arrays.stream(values())
                .filter(type -> type.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown monitor type code: " + code));
    }
}
