package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.TagPlacement;
import com.koni.tracking.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class LocationRulesTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final LocationRules rules = new LocationRules();

    @Test
    void shouldFlagTagInDifferentRoom() {
        TagPlacement placement = TagPlacement.builder().mac("m").assignedRoom("301").currentRoom("302").build();

        assertThat(rules.isOutsideAssignedRoom(placement)).isTrue();
    }

    @Test
    void shouldNotFlagTagInAssignedRoomOrWithUnknownRoom() {
        assertThat(rules.isOutsideAssignedRoom(
                TagPlacement.builder().mac("m").assignedRoom("301").currentRoom("301").build())).isFalse();
        assertThat(rules.isOutsideAssignedRoom(
                TagPlacement.builder().mac("m").assignedRoom("301").build())).isFalse();
    }

    @Test
    void shouldFlagStayInDangerAreaLongerThanAllowed() {
        // Given
        TagPlacement placement = TagPlacement.builder()
                .mac("m")
                .dangerArea(true)
                .firstSeen(T0)
                .lastSeen(T0.plusSeconds(11 * 60))
                .stayDurationMinutes(10)
                .build();

        // When/Then
        assertThat(rules.isLongStayInDanger(placement)).isTrue();
    }

    @Test
    void shouldNotFlagStayAtLimitOrOutsideDangerArea() {
        TagPlacement atLimit = TagPlacement.builder()
                .mac("m").dangerArea(true).firstSeen(T0).lastSeen(T0.plusSeconds(10 * 60 + 59)).stayDurationMinutes(10)
                .build();
        TagPlacement safeArea = TagPlacement.builder()
                .mac("m").dangerArea(false).firstSeen(T0).lastSeen(T0.plusSeconds(3600)).stayDurationMinutes(10)
                .build();

        assertThat(rules.isLongStayInDanger(atLimit)).isFalse();
        assertThat(rules.isLongStayInDanger(safeArea)).isFalse();
    }
}
