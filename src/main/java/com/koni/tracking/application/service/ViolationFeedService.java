package com.koni.tracking.application.service;

import com.koni.tracking.domain.model.ViolationEvent;
import com.koni.tracking.domain.repository.ViolationEventRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Delivers unprocessed violation events upstream, each exactly once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ViolationFeedService {

    private final ConnectionPool connectionPool;
    private final ViolationEventRepository violationEventRepository;
    private final TrackingMetrics trackingMetrics;

    /**
     * Drains unprocessed events in id order into {@code id,monitor_type,mac,uuid,violation_ts;} records.
     * A record that would push the feed past {@code capacity} characters is left pending
     * and the scan moves on, so shorter later records can still fill the feed.
     * Only events this call marked processed are included.
     *
     * @param capacity maximum length of the returned feed
     * @return the concatenated records, empty if nothing is pending
     */
    public String drain(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Feed capacity must be positive: " + capacity);
        }

        StringBuilder feed = new StringBuilder();
        int delivered = 0;
        try (ConnectionLease lease = connectionPool.acquire()) {
            DataStoreSession session = lease.session();
            for (ViolationEvent event : violationEventRepository.findUnprocessed(session)) {
                String record = event.toFeedRecord();
                if (feed.length() + record.length() > capacity) {
                    continue;
                }
                if (violationEventRepository.markProcessed(session, event.getId())) {
                    feed.append(record);
                    delivered++;
                } else {
                    log.debug("Violation event {} was delivered by a concurrent drain", event.getId());
                }
            }
        }

        trackingMetrics.recordViolationsDelivered(delivered);
        log.info("Violation feed drained: events={}, length={}", delivered, feed.length());
        return feed.toString();
    }
}
