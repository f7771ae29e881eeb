package com.platform.provisioner.error;

import com.platform.provisioner.observability.LoggingConfig;
import com.platform.provisioner.observability.MetricsRegistry;
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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to {@link ErrorResponse}, logs them with a severity that follows
 * the error category and counts them by code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Provisioner Exceptions ====================
    
    @ExceptionHandler(LifecycleOperationException.class)
    public ResponseEntity<ErrorResponse> handleLifecycleOperation(
            LifecycleOperationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, traceId);
        recordMetric(errorCode);
        
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resourceKind", ex.getResourceKind());
        metadata.put("operation", ex.getOperation());
        if (ex.getResourceId() != null) {
            metadata.put("resourceId", ex.getResourceId());
        }
        addCauseMetadata(ex.getCause(), metadata);
        
        ErrorResponse response = ErrorResponse.of(errorCode, ex.getMessage(), status.value(), 
            request.getRequestURI(), traceId);
        response.setDetail(ex.getCause().getMessage());
        response.setMetadata(metadata);
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Resource not found: {} ({})", 
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), 
            HttpStatus.NOT_FOUND.value(), request.getRequestURI(), traceId);
        response.setMetadata(Map.of(
            "resourceKind", ex.getResourceType(),
            "resourceId", ex.getResourceId()
        ));
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), 
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
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
    
    @ExceptionHandler(ProvisionerException.class)
    public ResponseEntity<ErrorResponse> handleProvisionerException(
            ProvisionerException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, traceId);
        recordMetric(errorCode);
        
        ErrorResponse response = ErrorResponse.of(errorCode, ex.getMessage(), status.value(), 
            request.getRequestURI(), traceId);
        
        return ResponseEntity.status(status).body(response);
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        
        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Validation failed", 
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Invalid request body", 
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getMostSpecificCause().getMessage());
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST, 
            String.format("Method %s not supported for this endpoint", ex.getMethod()),
            HttpStatus.METHOD_NOT_ALLOWED.value(), request.getRequestURI(), traceId);
        
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", 
            HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }
    
    private void logError(ProvisionerException ex, String traceId) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void addCauseMetadata(ProvisionerException cause, Map<String, Object> metadata) {
        if (cause instanceof ConvergenceTimeoutException timeout) {
            metadata.put("lastState", timeout.getLastLabel());
            metadata.put("timeout", timeout.getTimeout().toString());
        } else if (cause instanceof UnexpectedStateException unexpected) {
            metadata.put("observedState", unexpected.getObservedLabel());
        } else if (cause instanceof RemoteOperationException remote && remote.getRemoteErrorCode() != null) {
            metadata.put("remoteErrorCode", remote.getRemoteErrorCode());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("provisioner.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    private HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND -> 
                HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR, MALFORMED_IDENTIFIER, INVALID_REQUEST, INVALID_CONVERGENCE_REQUEST -> 
                HttpStatus.BAD_REQUEST;
            case OPERATION_CANCELLED -> 
                HttpStatus.CONFLICT;
            case REMOTE_OPERATION_FAILED, REMOTE_RESPONSE_INVALID, UNEXPECTED_STATE -> 
                HttpStatus.BAD_GATEWAY;
            case REMOTE_UNAVAILABLE -> 
                HttpStatus.SERVICE_UNAVAILABLE;
            case CONVERGENCE_TIMEOUT -> 
                HttpStatus.GATEWAY_TIMEOUT;
            default -> 
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
