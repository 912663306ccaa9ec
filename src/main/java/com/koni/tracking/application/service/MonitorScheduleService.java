package com.koni.tracking.application.service;

import com.koni.tracking.domain.model.MonitorPolicy;
import com.koni.tracking.domain.model.PolicyTable;
import com.koni.tracking.domain.repository.MonitorPolicyRepository;
import com.koni.tracking.domain.service.MonitorWindow;
import com.koni.tracking.infrastructure.config.TrackingProperties;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;

/**
 * Recomputes the active flag of every monitor policy from its time-of-day window.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitorScheduleService {

    private final ConnectionPool connectionPool;
    private final MonitorPolicyRepository monitorPolicyRepository;
    private final TrackingProperties properties;
    private final Clock clock;

    /**
     * Refreshes all policy tables. Each table uses its own connection; a failing
     * table is logged and skipped.
     *
     * @return the number of policies whose active flag changed
     */
    public int refreshAll() {
        LocalTime localTime = MonitorWindow.localTime(clock, properties.getSchedule().getUtcOffsetHours());
        int changed = 0;
        for (PolicyTable table : PolicyTable.values()) {
            try {
                changed += refresh(table, localTime);
            } catch (RuntimeException e) {
                log.error("Failed to refresh monitor schedule of {}", table.getTableName(), e);
            }
        }
        log.debug("Monitor schedules refreshed at local time {}: changed={}", localTime, changed);
        return changed;
    }

    int refresh(PolicyTable table, LocalTime localTime) {
        int changed = 0;
        try (ConnectionLease lease = connectionPool.acquire()) {
            for (MonitorPolicy policy : monitorPolicyRepository.findAll(lease.session(), table)) {
                boolean active = MonitorWindow.isActive(policy, localTime);
                if (active != policy.isActive()) {
                    monitorPolicyRepository.updateActive(lease.session(), table, policy.getId(), active);
                    changed++;
                    log.info("Monitor policy {} of area {} in {} is now {}",
                            policy.getId(), policy.getAreaId(), table.getTableName(), active ? "active" : "inactive");
                }
            }
        }
        return changed;
    }
}
