package com.platform.provisioner.error;

/**
 * Standardized error codes for the provisioner.
 * Each error has a unique code that operators and clients can act on.
 * 
 * Format: PV-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Input errors (identifiers, requests)
 * - 3xx: Resource errors (not found)
 * - 4xx: Remote control plane errors
 * - 5xx: Convergence and lifecycle errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Input Errors (1xx) ====================
    
    VALIDATION_ERROR("PV-100", "Validation error", ErrorCategory.RECOVERABLE),
    MALFORMED_IDENTIFIER("PV-101", "Malformed resource identifier", ErrorCategory.FATAL),
    INVALID_REQUEST("PV-102", "Invalid request format", ErrorCategory.RECOVERABLE),
    INVALID_CONVERGENCE_REQUEST("PV-103", "Invalid convergence request", ErrorCategory.FATAL),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("PV-300", "Resource not found", ErrorCategory.RECOVERABLE),
    
    // ==================== Remote Errors (4xx) ====================
    
    REMOTE_OPERATION_FAILED("PV-400", "Remote operation failed", ErrorCategory.FATAL),
    REMOTE_UNAVAILABLE("PV-401", "Remote control plane unavailable", ErrorCategory.RECOVERABLE),
    REMOTE_RESPONSE_INVALID("PV-402", "Remote response could not be parsed", ErrorCategory.FATAL),
    
    // ==================== Convergence Errors (5xx) ====================
    
    UNEXPECTED_STATE("PV-501", "Resource reached an unexpected state", ErrorCategory.FATAL),
    CONVERGENCE_TIMEOUT("PV-502", "Resource did not converge before the deadline", ErrorCategory.RECOVERABLE),
    OPERATION_CANCELLED("PV-503", "Operation cancelled", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("PV-900", "Internal server error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("PV-903", "Serialization error", ErrorCategory.FATAL);
    
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
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - the operator can retry once the remote side settles.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the request or the remote object needs manual inspection.
         */
        FATAL
    }
}
