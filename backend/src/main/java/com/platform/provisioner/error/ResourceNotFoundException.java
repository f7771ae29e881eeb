package com.platform.provisioner.error;

/**
 * Exception for resource absence in a context where absence is not acceptable.
 */
public class ResourceNotFoundException extends ProvisionerException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(ErrorCode.RESOURCE_NOT_FOUND, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public ResourceNotFoundException(String resourceType, String resourceId, String detail) {
        super(ErrorCode.RESOURCE_NOT_FOUND, 
            String.format("%s not found: %s (%s)", resourceType, resourceId, detail));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
