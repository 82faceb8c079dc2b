package com.platform.driftdetector.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.driftdetector.classify.ClassifiedEntry;
import com.platform.driftdetector.classify.Severity;

import java.util.List;

/**
 * Classified changeset of one matched pair; an empty entry list means the resource is in sync.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceDrift(
    String address,
    String kind,
    List<ClassifiedEntry> entries
) {
    
    public ResourceDrift {
        entries = List.copyOf(entries);
    }
    
    public boolean isDrifted() {
        return !entries.isEmpty();
    }
    
    public Severity getHighestSeverity() {
        Severity highest = null;
        for (ClassifiedEntry entry : entries) {
            if (entry.severity().isMoreSevereThan(highest)) {
                highest = entry.severity();
            }
        }
        return highest;
    }
}
