package com.platform.driftdetector.classify;

import com.platform.driftdetector.diff.ChangeKind;
import com.platform.driftdetector.path.AttributePath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned classification rules indexed for lookup by kind.
 */
public class ClassificationRuleTable {
    
    private final String version;
    private final String framework;
    private final List<ClassificationRule> rules;
    private final Map<String, KindRules> byKind = new HashMap<>();
    
    public ClassificationRuleTable(String version, String framework, List<ClassificationRule> rules) {
        this.version = version;
        this.framework = framework;
        this.rules = List.copyOf(rules);
        for (ClassificationRule rule : this.rules) {
            byKind.computeIfAbsent(rule.kind(), k -> new KindRules()).add(rule);
        }
        byKind.values().forEach(KindRules::sortPrefixes);
    }
    
    public static ClassificationRuleTable empty() {
        return new ClassificationRuleTable("none", "none", List.of());
    }
    
    public String getVersion() {
        return version;
    }
    
    public String getFramework() {
        return framework;
    }
    
    public List<ClassificationRule> getRules() {
        return rules;
    }
    
    /**
     * Exact, then longest prefix, then wildcard rule of one kind (or of the global {@code *} kind).
     */
    Optional<ClassificationRule> lookup(String kind, String path, ChangeKind changeKind) {
        KindRules kindRules = byKind.get(kind);
        return kindRules != null ? kindRules.lookup(path, changeKind) : Optional.empty();
    }
    
    private static final class KindRules {
        private final Map<String, List<ClassificationRule>> exact = new HashMap<>();
        private final List<ClassificationRule> prefixes = new ArrayList<>();
        private final List<ClassificationRule> wildcards = new ArrayList<>();
        
        void add(ClassificationRule rule) {
            switch (rule.match()) {
                case EXACT -> exact.computeIfAbsent(rule.path(), p -> new ArrayList<>()).add(rule);
                case PREFIX -> prefixes.add(rule);
                case WILDCARD -> wildcards.add(rule);
            }
        }
        
        void sortPrefixes() {
            prefixes.sort(Comparator.comparingInt((ClassificationRule r) -> r.path().length()).reversed());
        }
        
        Optional<ClassificationRule> lookup(String path, ChangeKind changeKind) {
            for (ClassificationRule rule : exact.getOrDefault(path, List.of())) {
                if (rule.appliesTo(changeKind)) {
                    return Optional.of(rule);
                }
            }
            for (ClassificationRule rule : prefixes) {
                if (AttributePath.isWithin(path, rule.path()) && rule.appliesTo(changeKind)) {
                    return Optional.of(rule);
                }
            }
            for (ClassificationRule rule : wildcards) {
                if (rule.appliesTo(changeKind)) {
                    return Optional.of(rule);
                }
            }
            return Optional.empty();
        }
    }
}
