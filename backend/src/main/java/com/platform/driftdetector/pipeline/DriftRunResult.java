package com.platform.driftdetector.pipeline;

import com.platform.driftdetector.report.DriftReport;

public record DriftRunResult(String runId, DriftReport report) {
}
