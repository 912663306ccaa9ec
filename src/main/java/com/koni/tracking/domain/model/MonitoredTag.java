package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A tag and its currently assigned beacon.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class MonitoredTag {

    private final String mac;
    private final String uuid;

    public boolean hasBeacon() {
        return uuid != null && !uuid.isEmpty();
    }
}
