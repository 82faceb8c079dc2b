package com.platform.driftdetector.classify;

/**
 * Result of classifying one change.
 *
 * @param ruleId id of the matching rule, null when the global default applied
 */
public record Classification(
    Severity severity,
    String category,
    String ruleId
) {
    
    public static final String DEFAULT_CATEGORY = "uncategorized";
    
    public static final Classification DEFAULT = new Classification(Severity.INFORMATIONAL, DEFAULT_CATEGORY, null);
    
    static Classification from(ClassificationRule rule) {
        return new Classification(rule.severity(), rule.category(), rule.id());
    }
}
