package com.platform.driftdetector.report;

import com.platform.driftdetector.classify.ClassifiedEntry;
import com.platform.driftdetector.classify.Severity;
import com.platform.driftdetector.resource.ResourceModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregates per-pair changesets, orphans, unmanaged resources and rejected records into one
 * {@link DriftReport}.
 *
 * <p>Every section is re-sorted here (resources, orphans and unmanaged by address; unanalyzable
 * records by origin, address hint and input position), so the report does not depend on the
 * order in which the inputs were produced, parallel or not. No I/O.
 */
public class DriftReportBuilder {
    
    private static final Comparator<UnanalyzableRecord> UNANALYZABLE_ORDER = Comparator
        .comparing(UnanalyzableRecord::origin)
        .thenComparing(UnanalyzableRecord::addressHint, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparingInt(UnanalyzableRecord::position);
    
    private final String equivalenceTableVersion;
    private final String classificationTableVersion;
    private final String classificationFramework;
    
    public DriftReportBuilder(String equivalenceTableVersion, String classificationTableVersion,
            String classificationFramework) {
        this.equivalenceTableVersion = equivalenceTableVersion;
        this.classificationTableVersion = classificationTableVersion;
        this.classificationFramework = classificationFramework;
    }
    
    public DriftReport build(
            Collection<ResourceDrift> pairDiffs,
            Collection<ResourceModel> orphans,
            Collection<ResourceModel> unmanaged,
            Collection<UnanalyzableRecord> unanalyzable) {
        
        List<ResourceDrift> resources = new ArrayList<>(pairDiffs);
        resources.sort(Comparator.comparing(ResourceDrift::address));
        
        List<ResourceReference> orphanRefs = references(orphans);
        List<ResourceReference> unmanagedRefs = references(unmanaged);
        
        List<UnanalyzableRecord> rejected = new ArrayList<>(unanalyzable);
        rejected.sort(UNANALYZABLE_ORDER);
        
        requireDisjoint(resources, orphanRefs, unmanagedRefs);
        
        return new DriftReport(
            equivalenceTableVersion,
            classificationTableVersion,
            classificationFramework,
            summarize(resources, orphanRefs.size(), unmanagedRefs.size(), rejected.size()),
            resources,
            orphanRefs,
            unmanagedRefs,
            rejected
        );
    }
    
    private static List<ResourceReference> references(Collection<ResourceModel> models) {
        List<ResourceReference> refs = new ArrayList<>(models.size());
        for (ResourceModel model : models) {
            refs.add(ResourceReference.of(model));
        }
        refs.sort(Comparator.comparing(ResourceReference::address));
        return refs;
    }
    
    private static ReportSummary summarize(List<ResourceDrift> resources, int orphans, int unmanaged, int unanalyzable) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        
        int totalEntries = 0;
        int drifted = 0;
        Severity highest = null;
        for (ResourceDrift resource : resources) {
            if (resource.isDrifted()) {
                drifted++;
            }
            for (ClassifiedEntry entry : resource.entries()) {
                counts.merge(entry.severity(), 1, Integer::sum);
                totalEntries++;
                if (entry.severity().isMoreSevereThan(highest)) {
                    highest = entry.severity();
                }
            }
        }
        
        return new ReportSummary(
            Collections.unmodifiableMap(counts),
            totalEntries,
            highest,
            resources.size(),
            drifted,
            orphans,
            unmanaged,
            unanalyzable
        );
    }
    
    private static void requireDisjoint(List<ResourceDrift> resources, List<ResourceReference> orphans,
            List<ResourceReference> unmanaged) {
        Set<String> seen = new HashSet<>();
        for (ResourceDrift resource : resources) {
            requireNew(seen, resource.address());
        }
        for (ResourceReference ref : orphans) {
            requireNew(seen, ref.address());
        }
        for (ResourceReference ref : unmanaged) {
            requireNew(seen, ref.address());
        }
    }
    
    private static void requireNew(Set<String> seen, String address) {
        if (!seen.add(address)) {
            throw new IllegalStateException("Address listed more than once in drift report: " + address);
        }
    }
}
