package com.platform.driftdetector.error;

/**
 * Base exception for all drift detector exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class DriftDetectorException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected DriftDetectorException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected DriftDetectorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected DriftDetectorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
