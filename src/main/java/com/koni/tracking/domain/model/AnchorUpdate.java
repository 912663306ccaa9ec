package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * New weighted anchor location of a tag, in millimetres.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class AnchorUpdate {

    private final String mac;
    private final int x;
    private final int y;
}
