package com.koni.tracking.application.service;

import com.koni.tracking.domain.exception.DatabaseUnavailableException;
import com.koni.tracking.domain.repository.MaintenanceRepository;
import com.koni.tracking.domain.repository.TrackingSampleRepository;
import com.koni.tracking.domain.repository.ViolationEventRepository;
import com.koni.tracking.infrastructure.config.TrackingProperties;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Data retention and table housekeeping.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaintenanceService {

    private final ConnectionPool connectionPool;
    private final TrackingSampleRepository trackingSampleRepository;
    private final ViolationEventRepository violationEventRepository;
    private final MaintenanceRepository maintenanceRepository;
    private final TrackingProperties properties;
    private final Clock clock;

    /**
     * Deletes violation events and tracking samples older than the retention period.
     * The two tables are purged independently.
     */
    public void deleteExpiredData() {
        Instant cutoff = clock.instant().minus(properties.getMaintenance().getRetention());

        try (ConnectionLease lease = connectionPool.acquire()) {
            int deleted = violationEventRepository.deleteOlderThan(lease.session(), cutoff);
            log.info("Deleted {} violation events older than {}", deleted, cutoff);
        } catch (RuntimeException e) {
            log.error("Failed to delete expired violation events", e);
        }

        try (ConnectionLease lease = connectionPool.acquire()) {
            int deleted = trackingSampleRepository.deleteOlderThan(lease.session(), cutoff);
            log.info("Deleted {} tracking samples older than {}", deleted, cutoff);
        } catch (RuntimeException e) {
            log.error("Failed to delete expired tracking samples", e);
        }
    }

    /**
     * Vacuums the configured tables, one connection loan per table. A table whose
     * connection cannot be borrowed is skipped; a failing VACUUM stops the run.
     */
    public void vacuum() {
        for (String table : properties.getMaintenance().getVacuumTables()) {
            ConnectionLease lease;
            try {
                lease = connectionPool.acquire();
            } catch (DatabaseUnavailableException e) {
                log.warn("Skipping VACUUM of {}: {}", table, e.getMessage());
                continue;
            }
            try (ConnectionLease held = lease) {
                maintenanceRepository.vacuum(held.session(), table);
                log.debug("Vacuumed {}", table);
            }
        }
        log.info("Vacuumed {} tables", properties.getMaintenance().getVacuumTables().size());
    }
}
