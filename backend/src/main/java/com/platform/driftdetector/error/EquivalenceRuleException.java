package com.platform.driftdetector.error;

/**
 * Malformed equivalence table entry, raised while the table is loaded.
 */
public class EquivalenceRuleException extends DriftDetectorException {
    
    public EquivalenceRuleException(String message) {
        super(ErrorCode.EQUIVALENCE_RULE_INVALID, message);
    }
    
    public EquivalenceRuleException(String message, Throwable cause) {
        super(ErrorCode.EQUIVALENCE_RULE_INVALID, message, cause);
    }
}
