package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of one stable/moving classification cycle.
 * A tag appears in at most one of the two lists.
 */
@Getter
@AllArgsConstructor
public class ClassificationResult {

    private final List<StableTagUpdate> stableTags;
    private final List<MovingTagUpdate> movingTags;
}
