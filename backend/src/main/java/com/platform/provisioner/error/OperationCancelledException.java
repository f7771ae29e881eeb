package com.platform.provisioner.error;

/**
 * Thrown when the caller cancels an in-flight operation.
 */
public class OperationCancelledException extends ProvisionerException {
    
    private final String resourceId;
    
    public OperationCancelledException(String resourceId) {
        super(ErrorCode.OPERATION_CANCELLED, String.format("operation on %s was cancelled", resourceId));
        this.resourceId = resourceId;
    }
    
    public OperationCancelledException(String resourceId, Throwable cause) {
        super(ErrorCode.OPERATION_CANCELLED, String.format("operation on %s was cancelled", resourceId), cause);
        this.resourceId = resourceId;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
