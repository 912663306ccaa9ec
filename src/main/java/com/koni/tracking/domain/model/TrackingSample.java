package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One proximity observation of a tag by a beacon, as decoded from a tracking report.
 * Immutable; consumed once by the ingestion pipeline.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class TrackingSample {

    private final String tagMac;
    private final String beaconUuid;
    private final int rssi;
    private final Instant initialTimestamp;
    private final Instant finalTimestamp;
    private final boolean panic;
    private final BigDecimal batteryVoltage;

    /**
     * Seconds between the beacon's report timestamp and the server receiving it.
     * Used to correct for gateway and server clock drift.
     */
    private final long beaconReportLatency;
}
