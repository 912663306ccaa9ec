package com.koni.tracking.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Data Transfer Object representing the current location state of one tag.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TagSummaryResponse {

    private String mac;
    private String uuid;
    private Integer rssi;
    private Instant firstSeen;
    private Instant lastSeen;
    private BigDecimal batteryVoltage;
    private Integer anchorX;
    private Integer anchorY;
    private Instant geofenceViolationTimestamp;
    private Instant panicViolationTimestamp;
    private Instant movementViolationTimestamp;
    private Instant locationViolationTimestamp;
}
