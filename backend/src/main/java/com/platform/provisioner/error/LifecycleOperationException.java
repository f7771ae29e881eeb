package com.platform.provisioner.error;

/**
 * Adds resource kind, identifier and operation to a failure surfaced by the lifecycle orchestrator.
 * The error code of the underlying cause is preserved.
 */
public class LifecycleOperationException extends ProvisionerException {
    
    private final String resourceKind;
    private final String resourceId;
    private final String operation;
    
    public LifecycleOperationException(String resourceKind, String resourceId, String operation, 
            ProvisionerException cause) {
        super(cause.getErrorCode(),
            String.format("%s %s (%s): %s", operation, resourceKind, 
                resourceId == null ? "no id" : resourceId, cause.getMessage()),
            cause);
        this.resourceKind = resourceKind;
        this.resourceId = resourceId;
        this.operation = operation;
    }
    
    public String getResourceKind() {
        return resourceKind;
    }
    
    public String getResourceId() {
        return resourceId;
    }
    
    public String getOperation() {
        return operation;
    }
    
    @Override
    public synchronized ProvisionerException getCause() {
        return (ProvisionerException) super.getCause();
    }
}
