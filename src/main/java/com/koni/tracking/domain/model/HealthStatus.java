package com.koni.tracking.domain.model;

import com.koni.tracking.domain.exception.ProtocolFormatException;

/**
 * Health status codes reported by gateways and beacons.
 */
public final class HealthStatus {

    public static final int NORMAL = 0;

    private HealthStatus() {
    }

    public static int parse(String code) {
        try {
            return Integer.parseInt(code.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolFormatException("Invalid health status: " + code, e);
        }
    }
}
