package com.platform.driftdetector.error;

import com.platform.driftdetector.observability.LoggingConfig;
import com.platform.driftdetector.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for the drift API.
 * 
 * Converts exceptions to a standardized {@link ErrorResponse}, logs every error with a severity
 * matching its category and counts it in {@code drift.errors}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Drift Detector Exceptions ====================
    
    @ExceptionHandler(DriftDetectorException.class)
    public ResponseEntity<ErrorResponse> handleDriftDetectorException(
            DriftDetectorException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, correlationId);
        recordMetric(errorCode);
        
        ErrorResponse response = ErrorResponse.of(errorCode, ex.getMessage(), status.value(),
            request.getRequestURI(), correlationId);
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(AmbiguousAddressException.class)
    public ResponseEntity<ErrorResponse> handleAmbiguousAddress(
            AmbiguousAddressException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.error("[{}] FATAL: Ambiguous {} addresses {}", correlationId, ex.getOrigin(), ex.getAddresses());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
                HttpStatus.UNPROCESSABLE_ENTITY.value(), request.getRequestURI(), correlationId);
        response.setMetadata(Map.of(
            "origin", ex.getOrigin().name(),
            "addresses", ex.getAddresses()
        ));
        
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Resource not found: {} ({})",
            correlationId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
                HttpStatus.NOT_FOUND.value(), request.getRequestURI(), correlationId);
        response.setMetadata(Map.of(
            "resourceType", ex.getResourceType(),
            "resourceId", ex.getResourceId()
        ));
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Validation error: {}", correlationId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), correlationId);
        
        if (ex.getField() != null) {
            response.setFieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Spring Validation ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        
        log.warn("[{}] Validation failed: {} field errors", correlationId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Validation failed",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), correlationId);
        response.setFieldErrors(fieldErrors);
        
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Invalid request body: {}", correlationId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Invalid request body",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), correlationId);
        response.setDetail(ex.getMostSpecificCause().getMessage());
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Type mismatch: {} = {}", correlationId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_FIELD_VALUE,
            String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), correlationId);
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Method not supported: {} on {}", correlationId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST,
            String.format("Method %s not supported for this endpoint", ex.getMethod()),
            HttpStatus.METHOD_NOT_ALLOWED.value(), request.getRequestURI(), correlationId);
        
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.error("[{}] FATAL: Unexpected error: {}", correlationId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred",
            HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), correlationId);
        response.setDetail(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private String getOrCreateCorrelationId() {
        String correlationId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        if (correlationId == null) {
            correlationId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put(LoggingConfig.MDC_CORRELATION_ID, correlationId);
        }
        return correlationId;
    }
    
    private void logError(DriftDetectorException ex, ErrorCode errorCode, String correlationId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", correlationId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", correlationId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.recordError(errorCode.getCode());
    }
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, RUN_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE,
                INVALID_SELECTOR, NORMALIZATION_FAILED, MISSING_ADDRESS, MISSING_KIND, TYPE_VIOLATION ->
                HttpStatus.BAD_REQUEST;
            case AMBIGUOUS_ADDRESS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case RUN_CANCELLED -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
