package com.platform.driftdetector.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.driftdetector.error.DriftDetectorException;
import com.platform.driftdetector.report.DriftReport;
import com.platform.driftdetector.report.ReportSummary;

import java.time.Instant;

/**
 * History entry of one drift run. Completed runs carry the report summary, aborted runs the error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DriftRunSummary(
    String runId,
    Instant startedAt,
    long durationMs,
    RunOutcome outcome,
    String equivalenceTableVersion,
    String classificationTableVersion,
    ReportSummary summary,
    String errorCode,
    String errorMessage
) {
    
    public static DriftRunSummary completed(String runId, Instant startedAt, long durationMs, DriftReport report) {
        return new DriftRunSummary(
            runId,
            startedAt,
            durationMs,
            RunOutcome.COMPLETED,
            report.equivalenceTableVersion(),
            report.classificationTableVersion(),
            report.summary(),
            null,
            null
        );
    }
    
    public static DriftRunSummary aborted(String runId, Instant startedAt, long durationMs, RunOutcome outcome,
            String errorCode, String errorMessage) {
        return new DriftRunSummary(runId, startedAt, durationMs, outcome, null, null, null, errorCode, errorMessage);
    }
    
    public static DriftRunSummary aborted(String runId, Instant startedAt, long durationMs, RunOutcome outcome,
            DriftDetectorException e) {
        return aborted(runId, startedAt, durationMs, outcome, e.getErrorCode().getCode(), e.getMessage());
    }
}
