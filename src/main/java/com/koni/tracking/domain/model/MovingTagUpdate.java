package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Reassignment of a tag to its strongest beacon of the current window.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class MovingTagUpdate {

    private final String mac;
    private final String uuid;
    private final int rssi;
    private final BigDecimal batteryVoltage;
    private final Instant firstSeen;
    private final Instant lastSeen;
}
