package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * A de-duplicated violation raised for one tag.
 * Immutable once created apart from its processed flag, which flips once on delivery.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ViolationEvent {

    private static final DateTimeFormatter FEED_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Long id;
    private final MonitorType monitorType;
    private final String mac;
    private final String uuid;
    private final Instant violationTimestamp;
    private final boolean processed;

    /**
     * Creates a new, not yet stored and not yet processed event.
     */
    public static ViolationEvent raise(MonitorType monitorType, String mac, String uuid, Instant violationTimestamp) {
        return new ViolationEvent(null, monitorType, mac, uuid, violationTimestamp, false);
    }

    /**
     * Formats the event as one record of the violation feed: {@code id,monitor_type,mac,uuid,violation_ts;}.
     */
    public String toFeedRecord() {
        return id + "," + monitorType.getCode() + "," + mac + "," + uuid + ","
                + FEED_TIMESTAMP.format(violationTimestamp) + ";";
    }
}
