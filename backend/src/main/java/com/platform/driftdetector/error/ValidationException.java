package com.platform.driftdetector.error;

/**
 * Exception for malformed drift run requests.
 */
public class ValidationException extends DriftDetectorException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public static ValidationException missingField(String field) {
        return new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, field, null,
            String.format("Missing required field '%s'", field));
    }
    
    public static ValidationException invalidField(String field, Object rejectedValue, String reason) {
        return new ValidationException(ErrorCode.INVALID_FIELD_VALUE, field, rejectedValue,
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, reason));
    }
    
    public static ValidationException invalidSelector(String expression, Throwable cause) {
        ValidationException ex = new ValidationException(ErrorCode.INVALID_SELECTOR, "observedJsonPath", expression,
            String.format("Invalid JSONPath expression '%s': %s", expression, cause.getMessage()));
        ex.initCause(cause);
        return ex;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
