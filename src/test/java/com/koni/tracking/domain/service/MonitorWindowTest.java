package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.MonitorPolicy;
import com.koni.tracking.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class MonitorWindowTest {

    @ParameterizedTest
    @CsvSource({
            "08:00, 17:00, 08:00, true",
            "08:00, 17:00, 16:59, true",
            "08:00, 17:00, 17:00, false",
            "08:00, 17:00, 07:59, false",
            "22:00, 06:00, 23:30, true",
            "22:00, 06:00, 03:00, true",
            "22:00, 06:00, 06:00, false",
            "22:00, 06:00, 12:00, false",
            "09:00, 09:00, 09:00, false"
    })
    void shouldMatchHalfOpenWindowIncludingMidnightWrap(String start, String end, String now, boolean expected) {
        assertThat(MonitorWindow.isWithin(LocalTime.parse(start), LocalTime.parse(end), LocalTime.parse(now)))
                .isEqualTo(expected);
    }

    @Test
    void shouldNeverActivateDisabledPolicy() {
        MonitorPolicy disabled = new MonitorPolicy(1L, 3, false, LocalTime.of(0, 0), LocalTime.of(23, 59), true);
        MonitorPolicy enabled = new MonitorPolicy(2L, 3, true, LocalTime.of(0, 0), LocalTime.of(23, 59), false);

        assertThat(MonitorWindow.isActive(disabled, LocalTime.NOON)).isFalse();
        assertThat(MonitorWindow.isActive(enabled, LocalTime.NOON)).isTrue();
    }

    @Test
    void shouldShiftClockByUtcOffset() {
        // Given
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T22:30:00Z"), ZoneOffset.UTC);

        // When/Then
        assertThat(MonitorWindow.localTime(clock, 8)).isEqualTo(LocalTime.of(6, 30));
        assertThat(MonitorWindow.localTime(clock, -5)).isEqualTo(LocalTime.of(17, 30));
    }
}
