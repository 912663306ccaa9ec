package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * An active geofence configuration row, as dumped for the geofence evaluator.
 */
@Getter
@AllArgsConstructor
public class GeoFenceSetting {

    private final int areaId;
    private final long id;
    private final String name;
    private final String perimeters;
    private final String fences;

    public String toDumpLine() {
        return areaId + ";" + id + ";" + name + ";" + perimeters + ";" + fences + ";";
    }
}
