package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.RssiReading;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Detects RSSI swings of a tag at its beacon by bucketing samples into fixed time slots.
 * 
 * A movement violation is raised when no pair of consecutive slots differs by more than
 * the RSSI delta, i.e. when the tag showed no significant motion over the window.
 */
public class MovementAnalyzer {

    /**
     * Counts consecutive-slot average differences that exceed the delta in either direction.
     *
     * @param readings the samples of one tag at one beacon
     * @param slot the time slot length, slots aligned to the epoch
     * @param rssiDelta the magnitude a difference must exceed
     * @return the number of qualifying differences
     */
    public int countSignificantDeltas(List<RssiReading> readings, Duration slot, int rssiDelta) {
        List<Double> averages = slotAverages(readings, slot);

        int significant = 0;
        for (int i = 1; i < averages.size(); i++) {
            double delta = averages.get(i) - averages.get(i - 1);
            if (delta > rssiDelta || delta < -rssiDelta) {
                significant++;
            }
        }
        return significant;
    }

    public boolean isMovementViolation(List<RssiReading> readings, Duration slot, int rssiDelta) {
        return countSignificantDeltas(readings, slot, rssiDelta) == 0;
    }

    /**
     * Average RSSI of every non-empty slot, oldest slot first.
     */
    List<Double> slotAverages(List<RssiReading> readings, Duration slot) {
        long slotSeconds = slot.getSeconds();
        if (slotSeconds <= 0) {
            throw new IllegalArgumentException("Time slot must be at least one second: " + slot);
        }

        Map<Long, long[]> slots = new TreeMap<>();
        for (RssiReading reading : readings) {
            long bucket = Math.floorDiv(reading.getTimestamp().getEpochSecond(), slotSeconds);
            long[] sumAndCount = slots.computeIfAbsent(bucket, key -> new long[2]);
            sumAndCount[0] += reading.getRssi();
            sumAndCount[1]++;
        }

        List<Double> averages = new ArrayList<>(slots.size());
        for (long[] sumAndCount : slots.values()) {
            averages.add((double) sumAndCount[0] / sumAndCount[1]);
        }
        return averages;
    }
}
