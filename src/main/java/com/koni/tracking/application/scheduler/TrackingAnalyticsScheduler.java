package com.koni.tracking.application.scheduler;

import com.koni.tracking.application.service.GeoFenceExportService;
import com.koni.tracking.application.service.LocationSummarizationService;
import com.koni.tracking.application.service.MaintenanceService;
import com.koni.tracking.application.service.MonitorScheduleService;
import com.koni.tracking.application.service.ViolationDetectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic background jobs: the summarization and violation cycle, monitor schedule
 * refresh, retention and housekeeping, and the geofence dump.
 * 
 * A failing step is logged and the job carries on with the next step; the next run
 * starts over.
 */
@Component
@ConditionalOnProperty(prefix = "tracking.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TrackingAnalyticsScheduler {

    private final LocationSummarizationService locationSummarizationService;
    private final ViolationDetectionService violationDetectionService;
    private final MonitorScheduleService monitorScheduleService;
    private final MaintenanceService maintenanceService;
    private final GeoFenceExportService geoFenceExportService;

    @Scheduled(fixedDelayString = "${tracking.summarization.interval:PT5S}")
    public void runAnalyticsCycle() {
        runStep("location summarization", locationSummarizationService::summarize);
        runStep("room violation detection", violationDetectionService::detectRoomViolations);
        runStep("long stay violation detection", violationDetectionService::detectLongStayViolations);
        runStep("movement violation detection", violationDetectionService::detectMovementViolations);
        runStep("violation event collection", violationDetectionService::collectAllEvents);
    }

    @Scheduled(fixedDelayString = "${tracking.schedule.interval:PT1M}")
    public void refreshMonitorSchedules() {
        runStep("monitor schedule refresh", monitorScheduleService::refreshAll);
    }

    @Scheduled(fixedDelayString = "${tracking.maintenance.interval:PT1H}")
    public void runMaintenance() {
        runStep("expired data deletion", maintenanceService::deleteExpiredData);
        runStep("vacuum", maintenanceService::vacuum);
    }

    @Scheduled(fixedDelayString = "${tracking.export.interval:PT30S}")
    public void exportGeoFence() {
        runStep("geofence export", geoFenceExportService::export);
    }

    private void runStep(String name, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.error("Scheduled {} failed: {}", name, e.getMessage(), e);
        }
    }
}
