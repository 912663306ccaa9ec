package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.MonitorPolicy;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Time-of-day activation rule of monitor policies.
 */
public final class MonitorWindow {

    private MonitorWindow() {
    }

    /**
     * Local time of day: the clock's UTC time shifted by the configured offset.
     */
    public static LocalTime localTime(Clock clock, int utcOffsetHours) {
        return LocalTime.now(clock.withZone(ZoneOffset.UTC)).plusHours(utcOffsetHours);
    }

    public static boolean isActive(MonitorPolicy policy, LocalTime now) {
        return policy.isEnable() && isWithin(policy.getStartTime(), policy.getEndTime(), now);
    }

    /**
     * Checks {@code [start, end)}; a window whose start is after its end wraps past midnight.
     * An empty window ({@code start == end}) never matches.
     */
    public static boolean isWithin(LocalTime start, LocalTime end, LocalTime now) {
        if (start.isBefore(end)) {
            return !now.isBefore(start) && now.isBefore(end);
        }
        if (start.isAfter(end)) {
            return !now.isBefore(start) || now.isBefore(end);
        }
        return false;
    }
}
