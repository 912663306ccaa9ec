package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Current location state of one tracked tag, one row per tag.
 * Loaded as a snapshot at the start of a summarization cycle.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public class TagSummary {

    private final String mac;
    private final String uuid;
    private final Integer rssi;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final BigDecimal batteryVoltage;
    private final Integer anchorX;
    private final Integer anchorY;
    private final boolean locationUpdated;
    private final Instant geofenceViolationTimestamp;
    private final Instant panicViolationTimestamp;
    private final Instant movementViolationTimestamp;
    private final Instant locationViolationTimestamp;

    public boolean hasAnchor() {
        return anchorX != null && anchorY != null;
    }
}
