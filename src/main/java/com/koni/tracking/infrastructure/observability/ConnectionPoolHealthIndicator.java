package com.koni.tracking.infrastructure.observability;

import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the data store connection pool.
 * 
 * Borrows one pooled session and validates it. Reports DOWN if no connection
 * could be borrowed or the borrowed session is no longer valid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionPoolHealthIndicator implements HealthIndicator {

    private final ConnectionPool connectionPool;

    @Override
    public Health health() {
        try (ConnectionLease lease = connectionPool.acquire()) {
            if (lease.session().isValid()) {
                log.debug("Connection pool health check passed: capacity={}, inUse={}",
                        connectionPool.getCapacity(), connectionPool.getInUse());

                return Health.up()
                        .withDetail("capacity", connectionPool.getCapacity())
                        .withDetail("inUse", connectionPool.getInUse())
                        .build();
            }

            log.error("Connection pool health check failed: session {} is not valid", lease.getSerialId());
            return Health.down()
                    .withDetail("error", "SessionValidationFailed")
                    .withDetail("serialId", lease.getSerialId())
                    .build();

        } catch (Exception e) {
            log.error("Connection pool health check failed", e);

            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(e.getMessage()))
                    .withDetail("capacity", connectionPool.getCapacity())
                    .build();
        }
    }
}
