package com.koni.tracking.application.command;

import com.koni.tracking.domain.exception.DatabaseUnavailableException;
import com.koni.tracking.domain.exception.StagingFileException;
import com.koni.tracking.domain.model.TrackingReport;
import com.koni.tracking.domain.model.TrackingSample;
import com.koni.tracking.domain.repository.TagSummaryRepository;
import com.koni.tracking.domain.repository.TrackingSampleRepository;
import com.koni.tracking.infrastructure.config.TrackingProperties;
import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import com.koni.tracking.infrastructure.persistence.staging.StagingFile;
import com.koni.tracking.infrastructure.persistence.staging.StagingFileFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.time.Clock;

/**
 * Command handler for tracking reports.
 * 
 * Responsibilities:
 * - Stamp panic violations right away for samples with the panic button pressed,
 *   unless panic monitoring is switched off
 * - Stage every sample of the report in a per-worker CSV file
 * - Bulk-load the staged samples in one statement, then delete the staging file
 * 
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordTrackingReportCommandHandler {

    private final ConnectionPool connectionPool;
    private final TagSummaryRepository tagSummaryRepository;
    private final TrackingSampleRepository trackingSampleRepository;
    private final StagingFileFactory stagingFileFactory;
    private final TrackingMetrics trackingMetrics;
    private final Clock clock;
    private final TrackingProperties properties;

    /**
     * Handles the command. The staging file is deleted whether or not the bulk load succeeds.
     * 
     * @param command the command carrying the parsed report
     * @throws StagingFileException if the staging file cannot be written or read
     * @throws DatabaseUnavailableException if no connection is available for the bulk load
     */
    public void handle(RecordTrackingReportCommand command) {
        TrackingReport report = command.getReport();
        log.debug("Handling RecordTrackingReportCommand: beacon={}, samples={}, panics={}",
                report.getBeaconUuid(), report.getSamples().size(), report.panicCount());

        trackingMetrics.recordReportReceived(report.getSamples().size());

        if (report.getSamples().isEmpty()) {
            log.debug("Tracking report from beacon {} carries no samples", report.getBeaconUuid());
            return;
        }

        boolean panicMonitoring = properties.getIngestion().isPanicMonitoringEnabled();
        try (StagingFile staging = stagingFileFactory.create()) {
            for (TrackingSample sample : report.getSamples()) {
                if (panicMonitoring && sample.isPanic()) {
                    stampPanic(sample);
                }
                staging.append(sample);
            }

            long loaded = bulkLoad(staging);
            log.info("Tracking report loaded: beacon={}, ip={}, samples={}",
                    report.getBeaconUuid(), report.getBeaconIp(), loaded);
        }
    }

    private void stampPanic(TrackingSample sample) {
        try (ConnectionLease lease = connectionPool.acquire()) {
            if (tagSummaryRepository.stampPanicIfMonitored(lease.session(), sample.getTagMac(), clock.instant())) {
                trackingMetrics.recordPanicStamped();
                log.info("Panic violation stamped: mac={}, beacon={}", sample.getTagMac(), sample.getBeaconUuid());
            } else {
                log.debug("Panic ignored for tag not monitored for panic: mac={}", sample.getTagMac());
            }
        } catch (DatabaseUnavailableException e) {
            log.error("Cannot stamp panic violation for mac={}, sample is still staged", sample.getTagMac(), e);
        }
    }

    private long bulkLoad(StagingFile staging) {
        try (ConnectionLease lease = connectionPool.acquire();
             Reader records = staging.openReader()) {
            return trackingSampleRepository.bulkLoad(lease.session(), records);
        } catch (IOException e) {
            throw new StagingFileException("Cannot close staged records " + staging.getPath(), e);
        }
    }
}
