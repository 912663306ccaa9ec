package com.koni.tracking.infrastructure.ingestion;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A decoded message received from a gateway.
 */
@Getter
@AllArgsConstructor
@ToString
public class InboundPacket {

    /**
     * Address of the gateway that sent the message.
     */
    private final String sourceAddress;
    private final MessageKind kind;
    private final String content;

    public InboundPacket withContent(String newContent) {
        return new InboundPacket(sourceAddress, kind, newContent);
    }
}
