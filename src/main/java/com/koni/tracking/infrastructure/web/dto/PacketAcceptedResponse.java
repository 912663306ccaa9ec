package com.koni.tracking.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Acknowledgement of a packet handed to an ingestion worker.
 */
@Getter
@AllArgsConstructor
public class PacketAcceptedResponse {

    private final String kind;
    private final String sourceAddress;
    private final int length;
}
