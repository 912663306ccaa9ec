package com.koni.tracking.application.service;

import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.model.MonitoredTag;
import com.koni.tracking.domain.model.RssiReading;
import com.koni.tracking.domain.model.TagPlacement;
import com.koni.tracking.domain.model.ViolationCandidate;
import com.koni.tracking.domain.model.ViolationEvent;
import com.koni.tracking.domain.repository.TagSummaryRepository;
import com.koni.tracking.domain.repository.TrackingSampleRepository;
import com.koni.tracking.domain.repository.ViolationEventRepository;
import com.koni.tracking.domain.service.LocationRules;
import com.koni.tracking.domain.service.MovementAnalyzer;
import com.koni.tracking.domain.service.ViolationDebouncer;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.infrastructure.config.TrackingProperties;
import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Stamps violation timestamps on tag summaries and turns them into debounced violation events.
 * 
 * Each detection rule and each event collection runs on its own connection loan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ViolationDetectionService {

    private final ConnectionPool connectionPool;
    private final TagSummaryRepository tagSummaryRepository;
    private final TrackingSampleRepository trackingSampleRepository;
    private final ViolationEventRepository violationEventRepository;
    private final TrackingProperties properties;
    private final TrackingMetrics trackingMetrics;
    private final Clock clock;
    private final LocationRules locationRules = new LocationRules();
    private final MovementAnalyzer movementAnalyzer = new MovementAnalyzer();
    private final ViolationDebouncer debouncer = new ViolationDebouncer();

    /**
     * Records a geofence breach signalled by the geofence evaluator.
     *
     * @param mac the tag mac address
     * @return true if the tag has a summary row that was stamped
     */
    public boolean reportGeofenceBreach(String mac) {
        try (ConnectionLease lease = connectionPool.acquire()) {
            int stamped = tagSummaryRepository.stampViolation(lease.session(), MonitorType.GEO_FENCE, mac, clock.instant());
            log.info("Geofence breach reported: mac={}, stamped={}", mac, stamped > 0);
            return stamped > 0;
        }
    }

    /**
     * Stamps a location violation on tags whose current beacon is outside the room
     * their object is assigned to.
     *
     * @return the number of tags stamped
     */
    public int detectRoomViolations() {
        try (ConnectionLease lease = connectionPool.acquire()) {
            DataStoreSession session = lease.session();
            Instant now = clock.instant();
            int stamped = 0;
            for (TagPlacement placement : tagSummaryRepository.findUnderActiveRoomPolicy(session)) {
                if (locationRules.isOutsideAssignedRoom(placement)) {
                    stamped += tagSummaryRepository.stampViolation(session, MonitorType.LOCATION, placement.getMac(), now);
                    log.debug("Tag outside assigned room: mac={}, assigned={}, current={}",
                            placement.getMac(), placement.getAssignedRoom(), placement.getCurrentRoom());
                }
            }
            return stamped;
        }
    }

    /**
     * Stamps a location violation on tags that stayed in a danger area longer than allowed.
     *
     * @return the number of tags stamped
     */
    public int detectLongStayViolations() {
        try (ConnectionLease lease = connectionPool.acquire()) {
            DataStoreSession session = lease.session();
            Instant now = clock.instant();
            int stamped = 0;
            for (TagPlacement placement : tagSummaryRepository.findUnderActiveDangerPolicy(session)) {
                if (locationRules.isLongStayInDanger(placement)) {
                    stamped += tagSummaryRepository.stampViolation(session, MonitorType.LOCATION, placement.getMac(), now);
                    log.debug("Tag stayed too long in danger area: mac={}, beacon={}", placement.getMac(), placement.getUuid());
                }
            }
            return stamped;
        }
    }

    /**
     * Stamps a movement violation on monitored tags that showed no significant RSSI
     * swing at their current beacon over the movement window.
     *
     * @return the number of tags stamped
     */
    public int detectMovementViolations() {
        TrackingProperties.Movement settings = properties.getMovement();

        try (ConnectionLease lease = connectionPool.acquire()) {
            DataStoreSession session = lease.session();
            Instant now = clock.instant();
            Instant since = now.minus(settings.getTimeWindow());
            int stamped = 0;
            for (MonitoredTag tag : tagSummaryRepository.findUnderActiveMovementPolicy(session)) {
                if (!tag.hasBeacon()) {
                    continue;
                }
                List<RssiReading> readings =
                        trackingSampleRepository.findRssiReadings(session, tag.getMac(), tag.getUuid(), since);
                if (movementAnalyzer.isMovementViolation(readings, settings.getSlot(), settings.getRssiDelta())) {
                    stamped += tagSummaryRepository.stampViolation(session, MonitorType.MOVEMENT, tag.getMac(), now);
                    log.debug("Movement violation: mac={}, beacon={}, readings={}",
                            tag.getMac(), tag.getUuid(), readings.size());
                }
            }
            return stamped;
        }
    }

    /**
     * Creates violation events for recent violation timestamps of one monitor type,
     * skipping those within the minimum gap of an existing event for the same tag and beacon.
     *
     * @return the number of events created
     */
    public int collectEvents(MonitorType monitorType) {
        TrackingProperties.Violation settings = properties.getViolation();

        try (ConnectionLease lease = connectionPool.acquire()) {
            DataStoreSession session = lease.session();
            Instant now = clock.instant();
            Instant since = now.minus(settings.getRecencyWindow());

            List<ViolationCandidate> candidates = tagSummaryRepository.findViolationsSince(session, monitorType, since);
            if (candidates.isEmpty()) {
                return 0;
            }
            List<ViolationEvent> existing = violationEventRepository.findByMonitorTypeSince(
                    session, monitorType, since.minus(settings.getMinimumGap()));

            List<ViolationEvent> raised = debouncer.select(
                    monitorType, candidates, existing, now, settings.getRecencyWindow(), settings.getMinimumGap());
            raised.forEach(event -> violationEventRepository.save(session, event));

            trackingMetrics.recordViolationsCreated(monitorType, raised.size());
            if (!raised.isEmpty()) {
                log.info("Violation events created: type={}, count={}", monitorType, raised.size());
            }
            return raised.size();
        }
    }

    /**
     * Collects events for every monitor type. A failure of one type does not stop the others.
     */
    public void collectAllEvents() {
        for (MonitorType monitorType : MonitorType.values()) {
            try {
                collectEvents(monitorType);
            } catch (RuntimeException e) {
                log.error("Failed to collect {} violation events", monitorType, e);
            }
        }
    }
}
