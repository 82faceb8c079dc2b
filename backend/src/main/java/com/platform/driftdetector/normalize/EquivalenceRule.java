package com.platform.driftdetector.normalize;

import com.platform.driftdetector.path.GlobPattern;

import java.math.BigDecimal;

/**
 * One entry of the equivalence table.
 *
 * @param kind         resource kind, kind glob ({@code kubernetes.*}) or {@code *}
 * @param path         attribute path glob
 * @param type         equivalence applied
 * @param defaultValue provider default, DEFAULT rules only
 * @param tolerance    absolute tolerance, COMPUTED_NUMERIC rules only (null = configured default)
 * @param strict       BOOLEAN/NUMBER: reject values that cannot be read, otherwise leave them as-is
 */
public record EquivalenceRule(
    GlobPattern kind,
    GlobPattern path,
    EquivalenceRuleType type,
    Object defaultValue,
    BigDecimal tolerance,
    boolean strict
) {
    
    public static EquivalenceRule of(String kind, String path, EquivalenceRuleType type) {
        return new EquivalenceRule(GlobPattern.of(kind), GlobPattern.of(path), type, null, null, true);
    }
    
    public boolean appliesToKind(String resourceKind) {
        return kind.matches(resourceKind);
    }
    
    public boolean appliesToPath(String attributePath) {
        return path.matches(attributePath);
    }
    
    public String describe() {
        return String.format("%s %s:%s", type, kind, path);
    }
}
