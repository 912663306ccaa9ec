package com.koni.tracking.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Identity and health of a gateway, keyed by ip address.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class GatewayRecord {

    private final String ipAddress;
    private final int healthStatus;
}
