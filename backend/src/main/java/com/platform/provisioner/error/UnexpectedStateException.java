package com.platform.provisioner.error;

import java.util.Set;

/**
 * Thrown when a polled resource reports a status outside the declared pending and target labels.
 */
public class UnexpectedStateException extends ProvisionerException {
    
    private final String resourceId;
    private final String observedLabel;
    private final Set<String> pending;
    private final Set<String> target;
    
    public UnexpectedStateException(String resourceId, String observedLabel, Set<String> pending, Set<String> target) {
        super(ErrorCode.UNEXPECTED_STATE,
            String.format("unexpected state '%s' for %s, wanted target %s (pending %s)", 
                observedLabel, resourceId, target, pending));
        this.resourceId = resourceId;
        this.observedLabel = observedLabel;
        this.pending = Set.copyOf(pending);
        this.target = Set.copyOf(target);
    }
    
    public String getResourceId() {
        return resourceId;
    }
    
    public String getObservedLabel() {
        return observedLabel;
    }
    
    public Set<String> getPending() {
        return pending;
    }
    
    public Set<String> getTarget() {
        return target;
    }
}
