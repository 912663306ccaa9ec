package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.model.ViolationCandidate;
import com.koni.tracking.domain.model.ViolationEvent;
import com.koni.tracking.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class ViolationDebouncerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Duration RECENCY = Duration.ofSeconds(30);
    private static final Duration GAP = Duration.ofSeconds(60);
    private static final String MAC = "AA:BB:CC:DD:EE:01";
    private static final String UUID = "00010018000000003460000000011";

    private final ViolationDebouncer debouncer = new ViolationDebouncer();

    @Test
    void shouldRaiseEventForRecentViolation() {
        // Given
        ViolationCandidate candidate = new ViolationCandidate(MAC, UUID, NOW.minusSeconds(5));

        // When
        List<ViolationEvent> raised = debouncer.select(
                MonitorType.PANIC, List.of(candidate), List.of(), NOW, RECENCY, GAP);

        // Then
        assertThat(raised).containsExactly(ViolationEvent.raise(MonitorType.PANIC, MAC, UUID, NOW.minusSeconds(5)));
        assertThat(raised.get(0).getId()).isNull();
        assertThat(raised.get(0).isProcessed()).isFalse();
    }

    @Test
    void shouldIgnoreViolationsOutsideRecencyWindow() {
        // Given
        List<ViolationCandidate> candidates = List.of(
                new ViolationCandidate(MAC, UUID, NOW.minusSeconds(31)),
                new ViolationCandidate("AA:BB:CC:DD:EE:02", UUID, null)
        );

        // When
        List<ViolationEvent> raised = debouncer.select(MonitorType.PANIC, candidates, List.of(), NOW, RECENCY, GAP);

        // Then
        assertThat(raised).isEmpty();
    }

    @Test
    void shouldSuppressViolationWithinMinimumGapOfExistingEvent() {
        // Given - a delivered event 40 seconds before the candidate
        ViolationEvent existing = new ViolationEvent(7L, MonitorType.LOCATION, MAC, UUID, NOW.minusSeconds(50), true);
        ViolationCandidate candidate = new ViolationCandidate(MAC, UUID, NOW.minusSeconds(10));

        // When
        List<ViolationEvent> raised = debouncer.select(
                MonitorType.LOCATION, List.of(candidate), List.of(existing), NOW, RECENCY, GAP);

        // Then
        assertThat(raised).isEmpty();
    }

    @Test
    void shouldRaiseViolationOnceGapHasElapsedOrKeyDiffers() {
        // Given
        ViolationEvent existing = new ViolationEvent(7L, MonitorType.LOCATION, MAC, UUID, NOW.minusSeconds(70), false);
        List<ViolationCandidate> candidates = List.of(
                new ViolationCandidate(MAC, UUID, NOW.minusSeconds(10)),
                new ViolationCandidate(MAC, "other-beacon", NOW.minusSeconds(10))
        );

        // When
        List<ViolationEvent> raised = debouncer.select(
                MonitorType.LOCATION, candidates, List.of(existing), NOW, RECENCY, GAP);

        // Then - exactly 60 seconds apart is enough
        assertThat(raised).extracting(ViolationEvent::getUuid).containsExactly(UUID, "other-beacon");
    }

    @Test
    void shouldIgnoreEventsOfOtherMonitorTypes() {
        // Given
        ViolationEvent panic = new ViolationEvent(1L, MonitorType.PANIC, MAC, UUID, NOW.minusSeconds(5), false);
        ViolationCandidate candidate = new ViolationCandidate(MAC, UUID, NOW.minusSeconds(5));

        // When
        List<ViolationEvent> raised = debouncer.select(
                MonitorType.MOVEMENT, List.of(candidate), List.of(panic), NOW, RECENCY, GAP);

        // Then
        assertThat(raised).hasSize(1);
    }

    @Test
    void shouldNeverCreateTwoEventsForSameKeyWithinGap() {
        // Given - a violation stamped every 10 seconds over five minutes, collected each cycle
        List<ViolationEvent> stored = new ArrayList<>();
        Instant start = NOW.minusSeconds(300);

        // When
        for (int second = 0; second <= 300; second += 10) {
            Instant stamp = start.plusSeconds(second);
            List<ViolationEvent> raised = debouncer.select(MonitorType.PANIC,
                    List.of(new ViolationCandidate(MAC, UUID, stamp)), stored, stamp, RECENCY, GAP);
            stored.addAll(raised);
        }

        // Then
        assertThat(stored).hasSize(6);
        for (int i = 1; i < stored.size(); i++) {
            Duration spacing = Duration.between(
                    stored.get(i - 1).getViolationTimestamp(), stored.get(i).getViolationTimestamp());
            assertThat(spacing).isGreaterThanOrEqualTo(GAP);
        }
    }
}
