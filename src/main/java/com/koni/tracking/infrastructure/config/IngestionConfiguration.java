package com.koni.tracking.infrastructure.config;

import com.koni.tracking.infrastructure.ingestion.InboundMessageHandler;
import com.koni.tracking.infrastructure.ingestion.IngestionDispatcher;
import com.koni.tracking.infrastructure.ingestion.PacketBufferPool;
import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class IngestionConfiguration {

    @Bean
    public PacketBufferPool packetBufferPool(TrackingProperties properties) {
        TrackingProperties.Ingestion ingestion = properties.getIngestion();
        return new PacketBufferPool(ingestion.getBufferSlots(), ingestion.getBufferCapacity());
    }

    /**
     * Fixed pool of ingestion workers. The dispatcher keeps at most {@code workers}
     * tasks outstanding, so the queue never fills.
     */
    @Bean
    public ThreadPoolTaskExecutor ingestionWorkerExecutor(TrackingProperties properties) {
        TrackingProperties.Ingestion ingestion = properties.getIngestion();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ingestion.getWorkers());
        executor.setMaxPoolSize(ingestion.getWorkers());
        executor.setQueueCapacity(ingestion.getWorkers());
        executor.setThreadNamePrefix("ingestion-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(ingestion.getShutdownTimeout().toMillis());
        return executor;
    }

    @Bean(destroyMethod = "shutdown")
    public IngestionDispatcher ingestionDispatcher(ThreadPoolTaskExecutor ingestionWorkerExecutor,
                                                   PacketBufferPool packetBufferPool,
                                                   InboundMessageHandler inboundMessageHandler,
                                                   TrackingMetrics trackingMetrics) {
        return new IngestionDispatcher(
            ingestionWorkerExecutor,
            packetBufferPool,
            inboundMessageHandler,
            trackingMetrics
        );
    }
}
