package com.platform.driftdetector.classify;

/**
 * How a classification rule's path is matched.
 */
public enum RuleMatchType {
    EXACT,      // path equals rule path
    PREFIX,     // path equals or lies below rule path, longest prefix wins
    WILDCARD    // any path of the kind
}
