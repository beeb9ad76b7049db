package com.platform.discovery.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends DiscoveryException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException run(String runId) {
        return new ResourceNotFoundException(ErrorCode.RUN_NOT_FOUND, "Discovery run", runId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
