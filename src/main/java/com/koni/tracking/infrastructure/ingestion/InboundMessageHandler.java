package com.koni.tracking.infrastructure.ingestion;

/**
 * Processes one inbound packet on an ingestion worker thread.
 */
@FunctionalInterface
public interface InboundMessageHandler {

    void handle(InboundPacket packet);
}
