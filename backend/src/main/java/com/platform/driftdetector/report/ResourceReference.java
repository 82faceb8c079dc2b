package com.platform.driftdetector.report;

import com.platform.driftdetector.resource.ResourceModel;
import com.platform.driftdetector.resource.SourceDialect;

/**
 * Orphaned or unmanaged resource as listed in a report.
 */
public record ResourceReference(
    String address,
    String kind,
    SourceDialect source,
    int attributeCount
) {
    
    public static ResourceReference of(ResourceModel model) {
        return new ResourceReference(model.address(), model.kind(), model.source(), model.attributes().size());
    }
}
