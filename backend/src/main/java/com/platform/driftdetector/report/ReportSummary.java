package com.platform.driftdetector.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.driftdetector.classify.Severity;

import java.util.Map;

/**
 * Totals of a drift report. Severity counts cover every classified entry and list every
 * severity, most severe first, zero included.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportSummary(
    Map<Severity, Integer> severityCounts,
    int totalEntries,
    Severity highestSeverity,
    int resourcesCompared,
    int driftedResources,
    int orphans,
    int unmanaged,
    int unanalyzable
) {
    
    public boolean hasDrift() {
        return driftedResources > 0 || orphans > 0 || unmanaged > 0;
    }
}
