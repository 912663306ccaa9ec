package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Health heartbeat of one LBeacon.
 */
@Getter
@AllArgsConstructor
@ToString
public class BeaconHealthReport {

    private final String uuid;
    private final long beaconTimestamp;
    private final String ipAddress;
    private final int healthStatus;
}
