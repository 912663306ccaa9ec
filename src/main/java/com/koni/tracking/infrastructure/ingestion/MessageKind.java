package com.koni.tracking.infrastructure.ingestion;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Kinds of inbound gateway messages, each with its own wire format.
 */
@Getter
@RequiredArgsConstructor
public enum MessageKind {
    TRACKING_REPORT("tracking-report"),
    GATEWAY_REGISTRATION("gateway-registration"),
    BEACON_REGISTRATION("beacon-registration"),
    GATEWAY_HEALTH("gateway-health"),
    BEACON_HEALTH("beacon-health");

    private final String pathSegment;

    /**
     * Resolves a kind from its URL path segment, e.g. {@code tracking-report}.
     *
     * @throws IllegalArgumentException if no kind has this segment
     */
    public static MessageKind fromPathSegment(String segment) {
        return Arrays.stream(values())
                .filter(kind -> kind.pathSegment.equalsIgnoreCase(segment))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown message kind: " + segment));
    }
}
