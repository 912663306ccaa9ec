package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * RSSI of one stored sample at its final timestamp.
 */
@Getter
@AllArgsConstructor
@ToString
public class RssiReading {

    private final Instant timestamp;
    private final int rssi;
}
