package com.platform.driftdetector.normalize;

/**
 * Ways two differently represented values can be declared equal.
 */
public enum EquivalenceRuleType {
    IGNORE,             // computed-only field, dropped with everything below it
    DEFAULT,            // provider-injected default, dropped when equal to the configured value
    BOOLEAN,            // "true"/"false" strings read as booleans
    NUMBER,             // numeric strings read as numbers
    CASE_INSENSITIVE,   // strings lower-cased
    TRAILING_SLASH,     // URIs compared without trailing slash
    SET,                // sequence compared as a multiset
    KEY_VALUE_LIST,     // [{Key, Value}] read as a map
    JSON_DOCUMENT,      // embedded JSON string parsed and flattened
    COMPUTED_NUMERIC    // numeric, compared within a tolerance
}
