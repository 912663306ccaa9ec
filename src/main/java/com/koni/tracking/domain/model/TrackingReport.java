package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * A fully parsed tracking report sent by one LBeacon through its gateway.
 */
@Getter
@AllArgsConstructor
@ToString
public class TrackingReport {

    private final String beaconUuid;
    private final long beaconTimestamp;
    private final String beaconIp;
    private final List<TrackingSample> samples;

    public long panicCount() {
        return samples.stream().filter(TrackingSample::isPanic).count();
    }
}
