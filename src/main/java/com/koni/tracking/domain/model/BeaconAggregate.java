package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Aggregate of the samples one beacon reported for one tag within a time window.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class BeaconAggregate {

    /**
     * Beacons whose average RSSI is at or below this floor are treated as noise.
     */
    public static final double AUDIBLE_RSSI_FLOOR = -100.0;

    private final String tagMac;
    private final String beaconUuid;
    private final double averageRssi;
    private final BigDecimal minBatteryVoltage;
    private final Instant earliestInitial;
    private final Instant latestFinal;

    /**
     * Average RSSI rounded half away from zero.
     */
    public int roundedRssi() {
        return BigDecimal.valueOf(averageRssi).setScale(0, RoundingMode.HALF_UP).intValue();
    }

    public boolean isAudible() {
        return averageRssi > AUDIBLE_RSSI_FLOOR;
    }
}
