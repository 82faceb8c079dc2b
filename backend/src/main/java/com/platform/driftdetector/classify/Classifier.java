package com.platform.driftdetector.classify;

import com.platform.driftdetector.diff.ChangeKind;
import com.platform.driftdetector.diff.DiffEntry;

import java.util.List;

/**
 * Assigns severity and category to changes from the classification rule table.
 *
 * <p>Lookup order: exact (kind, path), longest (kind, path prefix), (kind, *), then the same three
 * steps for rules of the global {@code *} kind, then INFORMATIONAL. Rules restricted to other
 * change kinds are skipped. The result depends only on the arguments and the immutable table.
 */
public class Classifier {
    
    private final ClassificationRuleTable ruleTable;
    
    public Classifier(ClassificationRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }
    
    public Classification classify(String kind, String path, ChangeKind changeKind) {
        return ruleTable.lookup(kind, path, changeKind)
            .or(() -> ruleTable.lookup(ClassificationRule.ANY_KIND, path, changeKind))
            .map(Classification::from)
            .orElse(Classification.DEFAULT);
    }
    
    public List<ClassifiedEntry> classifyAll(String kind, List<DiffEntry> entries) {
        return entries.stream()
            .map(entry -> ClassifiedEntry.of(entry, classify(kind, entry.path(), entry.changeKind())))
            .toList();
    }
}
