package com.platform.provisioner.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by every REST endpoint.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Stable error code (e.g., PV-502).
     */
    private String code;
    
    private String message;
    
    /**
     * Underlying cause, when it adds information.
     */
    private String detail;
    
    /**
     * Whether this error needs manual inspection (fatal) or may be retried (recoverable).
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    /**
     * Trace ID for correlating with logs.
     */
    private String traceId;
    
    private List<FieldError> fieldErrors;
    
    /**
     * Resource kind, identifier, operation and similar context.
     */
    private Map<String, Object> metadata;
    
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
    
    public static ErrorResponse of(ErrorCode errorCode, String message, int status, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }
}
