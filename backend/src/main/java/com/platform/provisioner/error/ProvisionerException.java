package com.platform.provisioner.error;

/**
 * Base exception for all provisioner exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ProvisionerException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ProvisionerException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected ProvisionerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ProvisionerException(ErrorCode errorCode, String message, Throwable cause) {
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
