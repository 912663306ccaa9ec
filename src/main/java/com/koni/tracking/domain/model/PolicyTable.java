package com.koni.tracking.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The monitor policy tables whose active flag is driven by the schedule activator.
 */
@Getter
@RequiredArgsConstructor
public enum PolicyTable {

    GEO_FENCE("geo_fence_config"),
    LOCATION_NOT_STAY_ROOM("location_not_stay_room_config"),
    LOCATION_LONG_STAY_IN_DANGER("location_long_stay_in_danger_config"),
    MOVEMENT("movement_config");

    private final String tableName;
}
