package com.koni.tracking.application.service;

import com.koni.tracking.domain.model.AnchorUpdate;
import com.koni.tracking.domain.model.BeaconAggregate;
import com.koni.tracking.domain.model.ClassificationResult;
import com.koni.tracking.domain.model.TagSummary;
import com.koni.tracking.domain.repository.DeviceRepository;
import com.koni.tracking.domain.repository.RssiWeightRepository;
import com.koni.tracking.domain.repository.TagSummaryRepository;
import com.koni.tracking.domain.repository.TrackingSampleRepository;
import com.koni.tracking.domain.service.AnchorLocator;
import com.koni.tracking.domain.service.LocationSummarizer;
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
 * Derives each tag's current beacon and anchor location from recent samples.
 * 
 * One cycle holds a single connection and runs, in order: reset of the updated
 * flags, the stable pass, the moving pass and the anchor pass. All passes work
 * from the summaries as they were at the start of the cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationSummarizationService {

    private final ConnectionPool connectionPool;
    private final TagSummaryRepository tagSummaryRepository;
    private final TrackingSampleRepository trackingSampleRepository;
    private final DeviceRepository deviceRepository;
    private final RssiWeightRepository rssiWeightRepository;
    private final TrackingProperties properties;
    private final TrackingMetrics trackingMetrics;
    private final Clock clock;
    private final LocationSummarizer summarizer = new LocationSummarizer();
    private final AnchorLocator anchorLocator = new AnchorLocator();

    public void summarize() {
        trackingMetrics.recordSummarizationTime(this::runCycle);
    }

    private void runCycle() {
        TrackingProperties.Summarization settings = properties.getSummarization();
        Instant now = clock.instant();
        Instant skewCutoff = now.minus(settings.getCurrentWindow());

        try (ConnectionLease lease = connectionPool.acquire()) {
            DataStoreSession session = lease.session();

            tagSummaryRepository.resetLocationUpdated(session);
            List<TagSummary> summaries = tagSummaryRepository.findAll(session);

            List<BeaconAggregate> preFilter = trackingSampleRepository.aggregateByTagAndBeacon(
                    session, now.minus(settings.getPreFilterWindow()), skewCutoff);
            List<BeaconAggregate> current = trackingSampleRepository.aggregateByTagAndBeacon(
                    session, now.minus(settings.getCurrentWindow()), skewCutoff);

            ClassificationResult classification =
                    summarizer.classify(summaries, preFilter, current, settings.getRssiTolerance());
            classification.getStableTags().forEach(update -> tagSummaryRepository.applyStable(session, update));
            classification.getMovingTags().forEach(update -> tagSummaryRepository.applyMoving(session, update));

            List<AnchorUpdate> anchors = anchorLocator.locate(
                    summaries,
                    preFilter,
                    deviceRepository.findBeaconCoordinates(session),
                    rssiWeightRepository.findAll(session),
                    settings.getAnchorTolerance());
            anchors.forEach(anchor -> tagSummaryRepository.applyAnchor(session, anchor));

            log.info("Location summarized: tags={}, stable={}, moving={}, anchors={}",
                    summaries.size(), classification.getStableTags().size(),
                    classification.getMovingTags().size(), anchors.size());
        }
    }
}
