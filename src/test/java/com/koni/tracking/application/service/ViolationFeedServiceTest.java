package com.koni.tracking.application.service;

import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.model.ViolationEvent;
import com.koni.tracking.domain.repository.ViolationEventRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import com.koni.tracking.infrastructure.persistence.pool.TestConnectionPools;
import com.koni.tracking.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ViolationFeedService.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class ViolationFeedServiceTest {

    private static final Instant AT = Instant.parse("2024-01-01T10:00:00Z");
    private static final String BEACON = "00010018000000003460000000000011";

    @Mock
    private DataStoreSession session;

    @Mock
    private ViolationEventRepository violationEventRepository;

    @Mock
    private TrackingMetrics trackingMetrics;

    private ConnectionPool connectionPool;
    private ViolationFeedService service;

    @BeforeEach
    void setUp() {
        connectionPool = TestConnectionPools.over(session, 1);
        service = new ViolationFeedService(connectionPool, violationEventRepository, trackingMetrics);
    }

    @Test
    void shouldDrainPendingEventsInIdOrder() {
        // Given
        when(violationEventRepository.findUnprocessed(session)).thenReturn(List.of(
                event(7L, MonitorType.GEO_FENCE, "AA:BB:CC:DD:EE:01"),
                event(8L, MonitorType.MOVEMENT, "AA:BB:CC:DD:EE:02")));
        when(violationEventRepository.markProcessed(session, 7L)).thenReturn(true);
        when(violationEventRepository.markProcessed(session, 8L)).thenReturn(true);

        // When
        String feed = service.drain(4096);

        // Then
        assertThat(feed).isEqualTo(
                "7,1,AA:BB:CC:DD:EE:01," + BEACON + ",2024-01-01 10:00:00;"
                        + "8,4,AA:BB:CC:DD:EE:02," + BEACON + ",2024-01-01 10:00:00;");
        verify(trackingMetrics).recordViolationsDelivered(2);
        assertThat(connectionPool.getInUse()).isZero();
    }

    @Test
    void shouldLeaveRecordsThatDoNotFitPendingAndKeepFillingWithLaterOnes() {
        // Given: the middle record is longer than the room left after the first
        ViolationEvent first = event(7L, MonitorType.PANIC, "AA:BB:CC:DD:EE:01");
        ViolationEvent oversized = new ViolationEvent(8L, MonitorType.PANIC, "AA:BB:CC:DD:EE:02",
                BEACON + "FFFF", AT, false);
        ViolationEvent third = event(9L, MonitorType.PANIC, "AA:BB:CC:DD:EE:03");
        int capacity = first.toFeedRecord().length() + third.toFeedRecord().length();
        when(violationEventRepository.findUnprocessed(session)).thenReturn(List.of(first, oversized, third));
        when(violationEventRepository.markProcessed(session, 7L)).thenReturn(true);
        when(violationEventRepository.markProcessed(session, 9L)).thenReturn(true);

        // When
        String feed = service.drain(capacity);

        // Then
        assertThat(feed).isEqualTo(first.toFeedRecord() + third.toFeedRecord());
        verify(violationEventRepository, never()).markProcessed(session, 8L);
        verify(trackingMetrics).recordViolationsDelivered(2);
    }

    @Test
    void shouldSkipEventsAlreadyDeliveredByConcurrentDrain() {
        // Given
        when(violationEventRepository.findUnprocessed(session)).thenReturn(List.of(
                event(7L, MonitorType.PANIC, "AA:BB:CC:DD:EE:01"),
                event(8L, MonitorType.PANIC, "AA:BB:CC:DD:EE:02")));
        when(violationEventRepository.markProcessed(session, 7L)).thenReturn(false);
        when(violationEventRepository.markProcessed(session, 8L)).thenReturn(true);

        // When
        String feed = service.drain(4096);

        // Then
        assertThat(feed).startsWith("8,2,AA:BB:CC:DD:EE:02,").doesNotContain("7,2,");
        verify(trackingMetrics).recordViolationsDelivered(1);
    }

    @Test
    void shouldReturnEmptyFeedWhenNothingIsPending() {
        // Given
        when(violationEventRepository.findUnprocessed(session)).thenReturn(List.of());

        // When
        String feed = service.drain(4096);

        // Then
        assertThat(feed).isEmpty();
        verify(violationEventRepository, never()).markProcessed(eq(session), anyLong());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        // When/Then
        assertThatThrownBy(() -> service.drain(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
        verifyNoInteractions(violationEventRepository);
    }

    private static ViolationEvent event(long id, MonitorType type, String mac) {
        return new ViolationEvent(id, type, mac, BEACON, AT, false);
    }
}
