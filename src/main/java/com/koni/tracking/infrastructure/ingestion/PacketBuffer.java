package com.koni.tracking.infrastructure.ingestion;

import com.koni.tracking.domain.exception.ProtocolFormatException;

import java.nio.charset.StandardCharsets;

/**
 * A fixed-capacity byte slot of the {@link PacketBufferPool}.
 * Used by one worker at a time; contents are overwritten on every borrow.
 */
public class PacketBuffer {

    private final int slot;
    private final byte[] bytes;
    private int length;

    PacketBuffer(int slot, int capacity) {
        this.slot = slot;
        this.bytes = new byte[capacity];
    }

    public int getSlot() {
        return slot;
    }

    public int getCapacity() {
        return bytes.length;
    }

    /**
     * Copies a message into the slot.
     *
     * @throws ProtocolFormatException if the encoded message does not fit
     */
    public void write(String message) {
        byte[] encoded = message.getBytes(StandardCharsets.UTF_8);
        if (encoded.length > bytes.length) {
            throw new ProtocolFormatException(
                    "Message of " + encoded.length + " bytes exceeds buffer capacity of " + bytes.length);
        }
        System.arraycopy(encoded, 0, bytes, 0, encoded.length);
        length = encoded.length;
    }

    public String read() {
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    void clear() {
        length = 0;
    }
}
