package com.koni.tracking.infrastructure.ingestion;

import com.koni.tracking.domain.exception.ProtocolFormatException;
import com.koni.tracking.infrastructure.config.IngestionConfiguration;
import com.koni.tracking.infrastructure.config.TrackingProperties;
import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import com.koni.tracking.tags.UnitTest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for IngestionDispatcher.
 * Tests hand-off to workers, worker/buffer accounting and failure isolation.
 */
@UnitTest
class IngestionDispatcherTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final TrackingMetrics metrics = new TrackingMetrics(registry);
    private IngestionDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
    }

    @Test
    void shouldDeliverPacketContentToHandlerOnWorkerThread() throws Exception {
        // Given
        List<String> threads = new CopyOnWriteArrayList<>();
        List<InboundPacket> handled = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        PacketBufferPool buffers = new PacketBufferPool(2, 256);
        dispatcher = new IngestionDispatcher(workerPool(2), buffers, packet -> {
            threads.add(Thread.currentThread().getName());
            handled.add(packet);
            done.countDown();
        }, metrics);

        // When
        dispatcher.dispatch(new InboundPacket("192.168.1.10", MessageKind.GATEWAY_REGISTRATION, "1;192.168.1.10;"));

        // Then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(handled).hasSize(1);
        assertThat(handled.get(0).getContent()).isEqualTo("1;192.168.1.10;");
        assertThat(handled.get(0).getSourceAddress()).isEqualTo("192.168.1.10");
        assertThat(threads.get(0)).startsWith("ingestion-worker-");
    }

    @Test
    void shouldReturnWorkerAndBufferEvenWhenHandlerFails() throws Exception {
        // Given
        CountDownLatch attempted = new CountDownLatch(3);
        PacketBufferPool buffers = new PacketBufferPool(1, 256);
        dispatcher = new IngestionDispatcher(workerPool(1), buffers, packet -> {
            attempted.countDown();
            throw new ProtocolFormatException("bad record");
        }, metrics);

        // When - three packets through one worker and one buffer
        for (int i = 0; i < 3; i++) {
            dispatcher.dispatch(new InboundPacket("gw", MessageKind.TRACKING_REPORT, "x"));
        }

        // Then
        assertThat(attempted.await(5, TimeUnit.SECONDS)).isTrue();
        dispatcher.shutdown();
        assertThat(dispatcher.getIdleWorkers()).isEqualTo(1);
        assertThat(buffers.available()).isEqualTo(1);
        assertThat(registry.find("tracking.dispatch.failures.total").counter().count()).isEqualTo(3.0);
    }

    @Test
    void shouldNeverRunMoreHandlersThanWorkers() throws Exception {
        // Given
        int workers = 3;
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch finished = new CountDownLatch(20);
        dispatcher = new IngestionDispatcher(workerPool(workers), new PacketBufferPool(8, 64), packet -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            finished.countDown();
        }, metrics);

        // When
        for (int i = 0; i < 20; i++) {
            dispatcher.dispatch(new InboundPacket("gw", MessageKind.BEACON_HEALTH, "p" + i));
        }

        // Then
        assertThat(finished.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(peak.get()).isLessThanOrEqualTo(workers);
    }

    @Test
    void shouldRejectOversizedMessageWithoutLeakingPermits() throws Exception {
        // Given
        PacketBufferPool buffers = new PacketBufferPool(1, 4);
        dispatcher = new IngestionDispatcher(workerPool(1), buffers, packet -> { }, metrics);

        // When/Then
        assertThatThrownBy(() -> dispatcher.dispatch(new InboundPacket("gw", MessageKind.GATEWAY_HEALTH, "too long")))
                .isInstanceOf(ProtocolFormatException.class);
        assertThat(dispatcher.getIdleWorkers()).isEqualTo(1);
        assertThat(buffers.available()).isEqualTo(1);
    }

    @Test
    void shouldRejectPacketsAfterShutdown() {
        // Given
        dispatcher = new IngestionDispatcher(workerPool(1), new PacketBufferPool(1, 64), packet -> { }, metrics);

        // When
        dispatcher.shutdown();

        // Then
        assertThatThrownBy(() -> dispatcher.dispatch(new InboundPacket("gw", MessageKind.GATEWAY_HEALTH, "1;0")))
                .isInstanceOf(RejectedExecutionException.class);
    }

    private static ThreadPoolTaskExecutor workerPool(int workers) {
        TrackingProperties properties = new TrackingProperties();
        properties.getIngestion().setWorkers(workers);
        properties.getIngestion().setShutdownTimeout(Duration.ofSeconds(5));
        ThreadPoolTaskExecutor executor = new IngestionConfiguration().ingestionWorkerExecutor(properties);
        executor.initialize();
        return executor;
    }
}
