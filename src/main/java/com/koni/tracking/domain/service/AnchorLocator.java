package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.AnchorUpdate;
import com.koni.tracking.domain.model.BeaconAggregate;
import com.koni.tracking.domain.model.BeaconCoordinates;
import com.koni.tracking.domain.model.RssiWeightBand;
import com.koni.tracking.domain.model.TagSummary;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Estimates the anchor location of each tag as the weighted average of the coordinates
 * of the beacons that heard it, stronger signals weighing more.
 */
public class AnchorLocator {

    /**
     * Computes anchor updates, suppressing jitter below the distance tolerance.
     *
     * @param summaries current tag summaries
     * @param aggregates per (tag, beacon) aggregates of the window
     * @param coordinates registered beacon coordinates keyed by uuid
     * @param bands the RSSI-to-weight table
     * @param toleranceMillimeters minimum move on either axis before an anchor is rewritten
     * @return one update per tag whose anchor was unset or moved far enough
     */
    public List<AnchorUpdate> locate(List<TagSummary> summaries,
                                     List<BeaconAggregate> aggregates,
                                     Map<String, BeaconCoordinates> coordinates,
                                     List<RssiWeightBand> bands,
                                     int toleranceMillimeters) {
        Map<String, List<BeaconAggregate>> byTag = aggregates.stream()
                .filter(BeaconAggregate::isAudible)
                .collect(Collectors.groupingBy(BeaconAggregate::getTagMac));

        List<AnchorUpdate> updates = new ArrayList<>();
        for (TagSummary summary : summaries) {
            List<BeaconAggregate> heard = byTag.get(summary.getMac());
            if (heard == null) {
                continue;
            }
            weightedAnchor(summary.getMac(), heard, coordinates, bands)
                    .filter(anchor -> hasMoved(summary, anchor, toleranceMillimeters))
                    .ifPresent(updates::add);
        }
        return updates;
    }

    private Optional<AnchorUpdate> weightedAnchor(String mac,
                                                  List<BeaconAggregate> heard,
                                                  Map<String, BeaconCoordinates> coordinates,
                                                  List<RssiWeightBand> bands) {
        long totalWeight = 0;
        long weightedX = 0;
        long weightedY = 0;

        for (BeaconAggregate aggregate : heard) {
            BeaconCoordinates position = coordinates.get(aggregate.getBeaconUuid());
            Optional<Integer> weight = weightOf(aggregate.getAverageRssi(), bands);
            if (position == null || weight.isEmpty()) {
                continue;
            }
            totalWeight += weight.get();
            weightedX += (long) position.getX() * weight.get();
            weightedY += (long) position.getY() * weight.get();
        }

        if (totalWeight == 0) {
            return Optional.empty();
        }
        return Optional.of(new AnchorUpdate(mac, divide(weightedX, totalWeight), divide(weightedY, totalWeight)));
    }

    static Optional<Integer> weightOf(double averageRssi, List<RssiWeightBand> bands) {
        return bands.stream()
                .filter(band -> band.contains(averageRssi))
                .map(RssiWeightBand::getWeight)
                .findFirst();
    }

    private static boolean hasMoved(TagSummary summary, AnchorUpdate anchor, int tolerance) {
        if (!summary.hasAnchor()) {
            return true;
        }
        return Math.abs(summary.getAnchorX() - anchor.getX()) >= tolerance
                || Math.abs(summary.getAnchorY() - anchor.getY()) >= tolerance;
    }

    private static int divide(long weightedSum, long totalWeight) {
        return BigDecimal.valueOf(weightedSum)
                .divide(BigDecimal.valueOf(totalWeight), 0, RoundingMode.HALF_UP)
                .intValue();
    }
}
