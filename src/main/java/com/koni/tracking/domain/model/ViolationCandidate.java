package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A tag summary whose violation timestamp for one monitor type is set.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ViolationCandidate {

    private final String mac;
    private final String uuid;
    private final Instant violationTimestamp;
}
