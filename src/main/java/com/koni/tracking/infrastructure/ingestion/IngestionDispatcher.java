package com.koni.tracking.infrastructure.ingestion;

import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Fans inbound packets out to a fixed pool of ingestion workers.
 * 
 * The receiver holds a worker permit and a packet buffer for every unit of work it
 * submits; when all workers are busy it waits instead of queueing. Workers give both
 * back on every exit path. Handler failures are logged and counted, never rethrown to
 * the receiver.
 */
@Slf4j
public class IngestionDispatcher {

    private final int workers;
    private final Semaphore workerPermits;
    private final ThreadPoolTaskExecutor executor;
    private final PacketBufferPool bufferPool;
    private final InboundMessageHandler handler;
    private final TrackingMetrics metrics;
    private volatile boolean accepting = true;

    public IngestionDispatcher(ThreadPoolTaskExecutor executor,
                               PacketBufferPool bufferPool,
                               InboundMessageHandler handler,
                               TrackingMetrics metrics) {
        this.workers = executor.getMaxPoolSize();
        this.workerPermits = new Semaphore(workers);
        this.executor = executor;
        this.bufferPool = bufferPool;
        this.handler = handler;
        this.metrics = metrics;
        log.info("Ingestion dispatcher started: workers={}", workers);
    }

    /**
     * Hands a packet to a worker, waiting for a free worker and buffer first.
     *
     * @param packet the packet to process
     * @throws InterruptedException if interrupted while waiting
     * @throws RejectedExecutionException if the dispatcher has been shut down
     * @throws com.koni.tracking.domain.exception.ProtocolFormatException if the message exceeds the buffer capacity
     */
    public void dispatch(InboundPacket packet) throws InterruptedException {
        if (!accepting) {
            throw new RejectedExecutionException("Ingestion dispatcher is shut down");
        }

        workerPermits.acquire();
        PacketBuffer buffer;
        try {
            buffer = bufferPool.borrow();
        } catch (InterruptedException e) {
            workerPermits.release();
            throw e;
        }

        try {
            buffer.write(packet.getContent());
            executor.execute(() -> process(packet, buffer));
        } catch (RuntimeException e) {
            bufferPool.release(buffer);
            workerPermits.release();
            throw e;
        }
        log.debug("Dispatched {} from {} to buffer slot {}", packet.getKind(), packet.getSourceAddress(), buffer.getSlot());
    }

    /**
     * Stops accepting packets and lets the worker pool drain in-flight work.
     */
    public void shutdown() {
        accepting = false;
        executor.shutdown();
        log.info("Ingestion dispatcher stopped");
    }

    public int getWorkers() {
        return workers;
    }

    public int getIdleWorkers() {
        return workerPermits.availablePermits();
    }

    private void process(InboundPacket packet, PacketBuffer buffer) {
        try {
            handler.handle(packet.withContent(buffer.read()));
        } catch (RuntimeException e) {
            metrics.recordDispatchFailure();
            log.error("Failed to process {} from {}", packet.getKind(), packet.getSourceAddress(), e);
        } finally {
            bufferPool.release(buffer);
            workerPermits.release();
        }
    }
}
