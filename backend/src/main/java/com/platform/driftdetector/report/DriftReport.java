package com.platform.driftdetector.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Outcome of one drift run, ready for an external renderer.
 *
 * <p>Immutable and free of timestamps or generated ids: identical inputs and tables produce an
 * identical report, and therefore identical serialized output.
 */
@JsonPropertyOrder({
    "equivalenceTableVersion", "classificationTableVersion", "classificationFramework",
    "summary", "resources", "orphans", "unmanaged", "unanalyzable"
})
public record DriftReport(
    String equivalenceTableVersion,
    String classificationTableVersion,
    String classificationFramework,
    ReportSummary summary,
    List<ResourceDrift> resources,
    List<ResourceReference> orphans,
    List<ResourceReference> unmanaged,
    List<UnanalyzableRecord> unanalyzable
) {
    
    public DriftReport {
        resources = List.copyOf(resources);
        orphans = List.copyOf(orphans);
        unmanaged = List.copyOf(unmanaged);
        unanalyzable = List.copyOf(unanalyzable);
    }
    
    public List<ResourceDrift> driftedResources() {
        return resources.stream().filter(ResourceDrift::isDrifted).toList();
    }
}
