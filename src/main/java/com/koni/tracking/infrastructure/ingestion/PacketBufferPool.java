package com.koni.tracking.infrastructure.ingestion;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Fixed set of packet buffers allocated once at start.
 * Borrowing waits until a slot is free; the pool never grows.
 */
@Slf4j
public class PacketBufferPool {

    private final int slots;
    private final int slotCapacity;
    private final BlockingQueue<PacketBuffer> free;

    public PacketBufferPool(int slots, int slotCapacity) {
        if (slots <= 0 || slotCapacity <= 0) {
            throw new IllegalArgumentException(
                    "Buffer pool needs positive slots and capacity: slots=" + slots + ", capacity=" + slotCapacity);
        }
        this.slots = slots;
        this.slotCapacity = slotCapacity;
        this.free = new ArrayBlockingQueue<>(slots);
        for (int slot = 0; slot < slots; slot++) {
            free.add(new PacketBuffer(slot, slotCapacity));
        }
        log.info("Packet buffer pool created: slots={}, capacity={} bytes", slots, slotCapacity);
    }

    public PacketBuffer borrow() throws InterruptedException {
        return free.take();
    }

    public void release(PacketBuffer buffer) {
        buffer.clear();
        if (!free.offer(buffer)) {
            throw new IllegalStateException("Buffer slot " + buffer.getSlot() + " returned to a full pool");
        }
    }

    public int available() {
        return free.size();
    }

    public int getSlots() {
        return slots;
    }

    public int getSlotCapacity() {
        return slotCapacity;
    }
}
