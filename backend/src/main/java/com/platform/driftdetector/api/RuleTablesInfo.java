package com.platform.driftdetector.api;

/**
 * Versions and sizes of the loaded rule tables.
 */
public record RuleTablesInfo(
    String classificationVersion,
    String classificationFramework,
    int classificationRuleCount,
    String equivalenceVersion,
    int equivalenceRuleCount
) {
}
