package com.koni.tracking.infrastructure.config;

import com.koni.tracking.domain.store.DataStoreSessionFactory;
import com.koni.tracking.infrastructure.persistence.jdbc.JdbcDataStoreSessionFactory;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import com.koni.tracking.infrastructure.persistence.staging.StagingFileFactory;
import io.github.resilience4j.retry.Retry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the relational store: session factory, the fixed-size connection pool and
 * the staging area for bulk loads.
 */
@Configuration
public class PersistenceConfiguration {

    @Bean
    public DataStoreSessionFactory dataStoreSessionFactory(TrackingProperties properties) {
        TrackingProperties.Database database = properties.getDatabase();
        return new JdbcDataStoreSessionFactory(
            database.getUrl(),
            database.getUsername(),
            database.getPassword(),
            database.getApplicationName()
        );
    }

    /**
     * Opens every pooled connection at startup; the application fails to start if the
     * store is unreachable.
     */
    @Bean(destroyMethod = "destroy")
    public ConnectionPool connectionPool(DataStoreSessionFactory sessionFactory,
                                         TrackingProperties properties,
                                         Retry connectionPoolRetry) {
        return ConnectionPool.create(sessionFactory, properties.getDatabase().getPoolSize(), connectionPoolRetry);
    }

    @Bean
    public StagingFileFactory stagingFileFactory(TrackingProperties properties) {
        return new StagingFileFactory(properties.getIngestion().getStagingDirectory());
    }
}
