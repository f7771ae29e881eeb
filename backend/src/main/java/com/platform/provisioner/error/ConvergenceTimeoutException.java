package com.platform.provisioner.error;

import java.time.Duration;

/**
 * Thrown when the deadline elapses while the resource is still in a pending state.
 * Carries the last observation for diagnostics.
 */
public class ConvergenceTimeoutException extends ProvisionerException {
    
    private final String resourceId;
    private final String lastLabel;
    private final transient Object lastSnapshot;
    private final Duration timeout;
    
    public ConvergenceTimeoutException(String resourceId, String lastLabel, Object lastSnapshot, Duration timeout) {
        super(ErrorCode.CONVERGENCE_TIMEOUT,
            String.format("timeout while waiting for %s to converge (last state: '%s', timeout: %s)", 
                resourceId, lastLabel, timeout));
        this.resourceId = resourceId;
        this.lastLabel = lastLabel;
        this.lastSnapshot = lastSnapshot;
        this.timeout = timeout;
    }
    
    public String getResourceId() {
        return resourceId;
    }
    
    public String getLastLabel() {
        return lastLabel;
    }
    
    /**
     * Last snapshot returned by the refresh function, or null when the resource was absent.
     */
    public Object getLastSnapshot() {
        return lastSnapshot;
    }
    
    public Duration getTimeout() {
        return timeout;
    }
}
