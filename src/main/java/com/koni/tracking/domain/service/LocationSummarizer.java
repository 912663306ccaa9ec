package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.BeaconAggregate;
import com.koni.tracking.domain.model.ClassificationResult;
import com.koni.tracking.domain.model.MovingTagUpdate;
import com.koni.tracking.domain.model.StableTagUpdate;
import com.koni.tracking.domain.model.TagSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Classifies tags as stable or moving from two windows of per-beacon aggregates.
 * 
 * A tag is stable when the pre-filter average of its assigned beacon is within the
 * RSSI tolerance of the current window's strongest beacon. Every other tag that has
 * a strongest beacon in the current window moves to that beacon. Tags without any
 * audible beacon in the current window are left out of both lists.
 */
public class LocationSummarizer {

    /**
     * Strongest beacon first; equal rounded averages are ordered by ascending uuid.
     */
    static final Comparator<BeaconAggregate> BEACON_RANKING =
            Comparator.comparingInt(BeaconAggregate::roundedRssi).reversed()
                    .thenComparing(BeaconAggregate::getBeaconUuid);

    /**
     * Runs the stable pass and then the moving pass over the same snapshot.
     *
     * @param summaries the tag summaries at the start of the cycle
     * @param preFilterAggregates per (tag, beacon) aggregates over the pre-filter window
     * @param currentAggregates per (tag, beacon) aggregates over the current window
     * @param rssiTolerance maximum RSSI difference, exclusive, for a tag to count as stable
     * @return the updates to apply; a tag appears in at most one list
     */
    public ClassificationResult classify(List<TagSummary> summaries,
                                         List<BeaconAggregate> preFilterAggregates,
                                         List<BeaconAggregate> currentAggregates,
                                         int rssiTolerance) {
        Map<String, BeaconAggregate> topBeacons = rankTopBeacons(currentAggregates);
        Map<String, BeaconAggregate> preFilterByPair = preFilterAggregates.stream()
                .collect(Collectors.toMap(LocationSummarizer::pairKey, Function.identity(), (a, b) -> a));

        List<StableTagUpdate> stable = new ArrayList<>();
        List<MovingTagUpdate> moving = new ArrayList<>();

        for (TagSummary summary : summaries) {
            BeaconAggregate top = topBeacons.get(summary.getMac());
            if (top == null) {
                continue;
            }

            BeaconAggregate assigned = summary.getUuid() == null
                    ? null
                    : preFilterByPair.get(pairKey(summary.getMac(), summary.getUuid()));

            if (assigned != null && Math.abs(assigned.roundedRssi() - top.roundedRssi()) < rssiTolerance) {
                stable.add(new StableTagUpdate(
                        summary.getMac(),
                        assigned.roundedRssi(),
                        assigned.getLatestFinal(),
                        assigned.getMinBatteryVoltage()
                ));
                continue;
            }

            moving.add(toMovingUpdate(summary, top));
        }

        return new ClassificationResult(stable, moving);
    }

    /**
     * Picks the strongest audible beacon of every tag.
     *
     * @param aggregates per (tag, beacon) aggregates of one window
     * @return the top-ranked aggregate keyed by tag mac
     */
    public Map<String, BeaconAggregate> rankTopBeacons(List<BeaconAggregate> aggregates) {
        Map<String, BeaconAggregate> top = new HashMap<>();
        for (BeaconAggregate aggregate : aggregates) {
            if (!aggregate.isAudible()) {
                continue;
            }
            top.merge(aggregate.getTagMac(), aggregate,
                    (current, candidate) -> BEACON_RANKING.compare(candidate, current) < 0 ? candidate : current);
        }
        return top;
    }

    private MovingTagUpdate toMovingUpdate(TagSummary summary, BeaconAggregate top) {
        boolean arrived = summary.getFirstSeen() == null || !Objects.equals(summary.getUuid(), top.getBeaconUuid());
        Instant firstSeen = arrived ? top.getEarliestInitial() : summary.getFirstSeen();

        return new MovingTagUpdate(
                summary.getMac(),
                top.getBeaconUuid(),
                top.roundedRssi(),
                top.getMinBatteryVoltage(),
                firstSeen,
                top.getLatestFinal()
        );
    }

    private static String pairKey(BeaconAggregate aggregate) {
        return pairKey(aggregate.getTagMac(), aggregate.getBeaconUuid());
    }

    private static String pairKey(String mac, String uuid) {
        return mac + '|' + uuid;
    }
}
