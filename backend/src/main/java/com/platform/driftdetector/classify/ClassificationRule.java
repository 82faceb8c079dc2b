package com.platform.driftdetector.classify;

import com.platform.driftdetector.diff.ChangeKind;

import java.util.Set;

/**
 * One row of the classification rule table.
 *
 * @param changeKinds change kinds the rule is restricted to; empty means all
 */
public record ClassificationRule(
    String id,
    String kind,
    RuleMatchType match,
    String path,
    Severity severity,
    String category,
    Set<ChangeKind> changeKinds,
    String description
) {
    
    public static final String ANY_KIND = "*";
    
    public ClassificationRule {
        changeKinds = changeKinds != null ? Set.copyOf(changeKinds) : Set.of();
    }
    
    public boolean appliesTo(ChangeKind changeKind) {
        return changeKinds.isEmpty() || changeKinds.contains(changeKind);
    }
}
