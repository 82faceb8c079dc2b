package com.platform.driftdetector.error;

/**
 * Malformed classification rule table entry, raised while the table is loaded.
 */
public class ClassificationRuleException extends DriftDetectorException {
    
    private final String ruleId;
    
    public ClassificationRuleException(String ruleId, String message) {
        super(ErrorCode.CLASSIFICATION_RULE_INVALID,
            ruleId != null ? String.format("Classification rule '%s': %s", ruleId, message) : message);
        this.ruleId = ruleId;
    }
    
    public ClassificationRuleException(String message, Throwable cause) {
        super(ErrorCode.CLASSIFICATION_RULE_INVALID, message, cause);
        this.ruleId = null;
    }
    
    public String getRuleId() {
        return ruleId;
    }
}
