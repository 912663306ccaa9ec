package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of the RSSI-to-weight table: averages in {@code [bottomRssi, upperRssi)} get {@code weight}.
 */
@Getter
@AllArgsConstructor
@ToString
public class RssiWeightBand {

    private final int bottomRssi;
    private final int upperRssi;
    private final int weight;

    public boolean contains(double averageRssi) {
        return averageRssi >= bottomRssi && averageRssi < upperRssi;
    }
}
