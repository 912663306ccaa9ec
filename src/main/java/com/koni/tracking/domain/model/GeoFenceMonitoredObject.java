package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * An object whose monitor type includes geofencing.
 */
@Getter
@AllArgsConstructor
public class GeoFenceMonitoredObject {

    private final int areaId;
    private final String macAddress;

    public String toDumpLine() {
        return areaId + ";" + macAddress + ";";
    }
}
