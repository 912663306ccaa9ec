package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalTime;

/**
 * A time-windowed monitor policy of one area.
 * The active flag is derived from the enable flag and the window, never edited by hand.
 */
@Getter
@AllArgsConstructor
@ToString
public class MonitorPolicy {

    private final long id;
    private final int areaId;
    private final boolean enable;
    private final LocalTime startTime;
    private final LocalTime endTime;
    private final boolean active;
}
