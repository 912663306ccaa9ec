package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A tag under an active location policy, joined with its object and current beacon.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class TagPlacement {

    private final String mac;
    private final String uuid;
    private final String assignedRoom;
    private final String currentRoom;
    private final boolean dangerArea;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final int stayDurationMinutes;
}
