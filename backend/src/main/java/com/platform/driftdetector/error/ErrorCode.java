package com.platform.driftdetector.error;

/**
 * Standardized error codes for the drift detector.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: DD-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation and normalization errors
 * - 3xx: Resource errors (not found, ambiguous identity)
 * - 5xx: Run errors
 * - 9xx: Internal and configuration errors
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("DD-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("DD-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("DD-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("DD-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    INVALID_SELECTOR("DD-104", "Invalid JSONPath selector", ErrorCategory.RECOVERABLE),
    
    NORMALIZATION_FAILED("DD-110", "Raw record could not be normalized", ErrorCategory.RECOVERABLE),
    MISSING_ADDRESS("DD-111", "No address derivable for raw record", ErrorCategory.RECOVERABLE),
    MISSING_KIND("DD-112", "No kind derivable for raw record", ErrorCategory.RECOVERABLE),
    TYPE_VIOLATION("DD-113", "Attribute value violates its declared type", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("DD-300", "Resource not found", ErrorCategory.RECOVERABLE),
    RUN_NOT_FOUND("DD-301", "Drift run not found", ErrorCategory.RECOVERABLE),
    AMBIGUOUS_ADDRESS("DD-310", "Duplicate resource address within one origin", ErrorCategory.FATAL),
    
    // ==================== Run Errors (5xx) ====================
    
    RUN_FAILED("DD-500", "Drift run failed", ErrorCategory.FATAL),
    RUN_CANCELLED("DD-520", "Drift run cancelled", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("DD-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("DD-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CLASSIFICATION_RULE_INVALID("DD-902", "Malformed classification rule table", ErrorCategory.FATAL),
    EQUIVALENCE_RULE_INVALID("DD-903", "Malformed equivalence table", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("DD-904", "Serialization error", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - recorded against a single record or request, the run may continue.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the run or configuration load is aborted.
         */
        FATAL
    }
}
