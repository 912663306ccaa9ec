package com.koni.tracking.infrastructure.config;

import com.koni.tracking.domain.exception.ConnectionPoolExhaustedException;
import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policy for borrowing pooled connections.
 * 
 * An exhausted pool is retried a bounded number of times with a fixed wait; once the
 * attempts run out the exhaustion reaches the caller. No other failure is retried.
 */
@Configuration
public class ResilienceConfiguration {

    public static final String CONNECTION_POOL_RETRY = "connection-pool";

    /**
     * @param properties supplies the attempt count and the wait between attempts
     * @return the retry config for pool acquisition
     */
    @Bean
    public RetryConfig connectionPoolRetryConfig(TrackingProperties properties) {
        TrackingProperties.Database database = properties.getDatabase();
        return RetryConfig.custom()
            .maxAttempts(database.getAcquisitionAttempts())
            .waitDuration(database.getAcquisitionWait())
            .retryExceptions(ConnectionPoolExhaustedException.class)
            .build();
    }

    @Bean
    public RetryRegistry retryRegistry(RetryConfig connectionPoolRetryConfig) {
        return RetryRegistry.of(connectionPoolRetryConfig);
    }

    /**
     * Creates the "connection-pool" retry and counts every acquisition that gave up.
     */
    @Bean
    public Retry connectionPoolRetry(RetryRegistry registry, TrackingMetrics metrics) {
        Retry retry = registry.retry(CONNECTION_POOL_RETRY);
        retry.getEventPublisher().onError(event -> metrics.recordPoolExhausted());
        return retry;
    }
}
