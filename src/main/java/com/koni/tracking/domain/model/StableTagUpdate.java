package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Refresh of a tag that stayed at its assigned beacon. First-seen time is left untouched.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class StableTagUpdate {

    private final String mac;
    private final int rssi;
    private final Instant lastSeen;
    private final BigDecimal batteryVoltage;
}
