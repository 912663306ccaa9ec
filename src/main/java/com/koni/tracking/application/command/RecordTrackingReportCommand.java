package com.koni.tracking.application.command;

import com.koni.tracking.domain.model.TrackingReport;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to persist the samples of one parsed tracking report.
 */
@Getter
@AllArgsConstructor
public class RecordTrackingReportCommand {

    @NotNull(message = "report is required")
    private final TrackingReport report;
}
