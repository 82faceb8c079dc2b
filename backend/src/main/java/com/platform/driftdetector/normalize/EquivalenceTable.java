package com.platform.driftdetector.normalize;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-kind field-normalization rules, loaded from external versioned data.
 *
 * <p>For a given kind, rules are consulted most specific first: exact kind, then kind globs
 * (longest literal prefix first), then {@code *}; within one kind pattern exact paths win over
 * globs. When several rules of the same type match a path, the first in that order is used.
 */
public class EquivalenceTable {
    
    private static final Comparator<EquivalenceRule> PRECEDENCE = Comparator
        .comparingInt((EquivalenceRule r) -> r.kind().isExact() ? 0 : r.kind().isMatchAll() ? 2 : 1)
        .thenComparingInt(r -> -r.kind().specificity())
        .thenComparingInt(r -> r.path().isExact() ? 0 : 1)
        .thenComparingInt(r -> -r.path().specificity());
    
    private final String version;
    private final List<EquivalenceRule> rules;
    private final Map<String, List<EquivalenceRule>> rulesByKind = new ConcurrentHashMap<>();
    
    public EquivalenceTable(String version, List<EquivalenceRule> rules) {
        this.version = version;
        this.rules = List.copyOf(rules);
    }
    
    public static EquivalenceTable empty() {
        return new EquivalenceTable("none", List.of());
    }
    
    public String getVersion() {
        return version;
    }
    
    public List<EquivalenceRule> getRules() {
        return rules;
    }
    
    /**
     * Rules applicable to a kind, in precedence order.
     */
    public List<EquivalenceRule> rulesFor(String kind) {
        return rulesByKind.computeIfAbsent(kind, k -> {
            List<EquivalenceRule> applicable = new ArrayList<>();
            for (EquivalenceRule rule : rules) {
                if (rule.appliesToKind(k)) {
                    applicable.add(rule);
                }
            }
            applicable.sort(PRECEDENCE);
            return List.copyOf(applicable);
        });
    }
    
    /**
     * The winning rule of each type for one path.
     */
    public Map<EquivalenceRuleType, EquivalenceRule> rulesAt(String kind, String path) {
        Map<EquivalenceRuleType, EquivalenceRule> result = new EnumMap<>(EquivalenceRuleType.class);
        for (EquivalenceRule rule : rulesFor(kind)) {
            if (!result.containsKey(rule.type()) && rule.appliesToPath(path)) {
                result.put(rule.type(), rule);
            }
        }
        return result;
    }
    
    public Optional<EquivalenceRule> ruleAt(String kind, String path, EquivalenceRuleType type) {
        for (EquivalenceRule rule : rulesFor(kind)) {
            if (rule.type() == type && rule.appliesToPath(path)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
    
    /**
     * True when the path or one of its ancestors is ignored for this kind.
     */
    public boolean isIgnored(String kind, String path) {
        for (EquivalenceRule rule : rulesFor(kind)) {
            if (rule.type() == EquivalenceRuleType.IGNORE && rule.path().matchesSubtree(path)) {
                return true;
            }
        }
        return false;
    }
    
    public boolean isSet(String kind, String path) {
        return ruleAt(kind, path, EquivalenceRuleType.SET).isPresent();
    }
    
    /**
     * Tolerance for a computed-numeric path, empty when the path requires exact equality.
     */
    public Optional<BigDecimal> toleranceAt(String kind, String path, BigDecimal defaultTolerance) {
        return ruleAt(kind, path, EquivalenceRuleType.COMPUTED_NUMERIC)
            .map(rule -> rule.tolerance() != null ? rule.tolerance() : defaultTolerance);
    }
}
