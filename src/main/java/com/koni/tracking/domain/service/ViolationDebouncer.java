package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.model.ViolationCandidate;
import com.koni.tracking.domain.model.ViolationEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns violation timestamps into events without flooding on sustained violations.
 * 
 * A candidate raises an event only if its timestamp is within the recency window and no
 * event of the same monitor type, mac and uuid lies less than the minimum gap before it.
 * Events count whether or not they were already delivered.
 */
public class ViolationDebouncer {

    /**
     * Selects the candidates that raise a new event.
     *
     * @param monitorType the monitor type being collected
     * @param candidates summaries with a violation timestamp of that type
     * @param existing stored events of that type that may fall within the gap
     * @param now the collection time
     * @param recencyWindow how old a violation timestamp may be
     * @param minimumGap minimum spacing between two events of the same key
     * @return the new events, in candidate order
     */
    public List<ViolationEvent> select(MonitorType monitorType,
                                       List<ViolationCandidate> candidates,
                                       List<ViolationEvent> existing,
                                       Instant now,
                                       Duration recencyWindow,
                                       Duration minimumGap) {
        Instant oldestAccepted = now.minus(recencyWindow);
        List<ViolationEvent> known = new ArrayList<>(existing);
        List<ViolationEvent> raised = new ArrayList<>();

        for (ViolationCandidate candidate : candidates) {
            if (candidate.getViolationTimestamp() == null
                    || candidate.getViolationTimestamp().isBefore(oldestAccepted)) {
                continue;
            }
            if (isDebounced(monitorType, candidate, known, minimumGap)) {
                continue;
            }
            ViolationEvent event = ViolationEvent.raise(
                    monitorType, candidate.getMac(), candidate.getUuid(), candidate.getViolationTimestamp());
            raised.add(event);
            known.add(event);
        }
        return raised;
    }

    private static boolean isDebounced(MonitorType monitorType,
                                       ViolationCandidate candidate,
                                       List<ViolationEvent> known,
                                       Duration minimumGap) {
        return known.stream()
                .filter(event -> event.getMonitorType() == monitorType)
                .filter(event -> Objects.equals(event.getMac(), candidate.getMac()))
                .filter(event -> Objects.equals(event.getUuid(), candidate.getUuid()))
                .anyMatch(event -> Duration.between(event.getViolationTimestamp(), candidate.getViolationTimestamp())
                        .compareTo(minimumGap) < 0);
    }
}
