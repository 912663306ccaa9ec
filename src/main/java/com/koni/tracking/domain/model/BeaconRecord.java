package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Identity, location and health of an LBeacon, keyed by uuid.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class BeaconRecord {

    private final String uuid;
    private final String ipAddress;
    private final String gatewayIpAddress;
    private final int healthStatus;

    /**
     * Registration time reported by the beacon, written on first sight only.
     */
    private final Instant registeredAt;
    private final BeaconCoordinates coordinates;
}
