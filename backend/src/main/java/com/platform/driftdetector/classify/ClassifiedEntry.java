package com.platform.driftdetector.classify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.platform.driftdetector.diff.ChangeKind;
import com.platform.driftdetector.diff.DiffEntry;

/**
 * A diff entry annotated with severity and category.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"path", "changeKind", "declaredValue", "observedValue", "severity", "category", "ruleId"})
public record ClassifiedEntry(
    String path,
    ChangeKind changeKind,
    Object declaredValue,
    Object observedValue,
    Severity severity,
    String category,
    String ruleId
) {
    
    public static ClassifiedEntry of(DiffEntry entry, Classification classification) {
        return new ClassifiedEntry(
            entry.path(),
            entry.changeKind(),
            entry.declaredValue(),
            entry.observedValue(),
            classification.severity(),
            classification.category(),
            classification.ruleId()
        );
    }
}
