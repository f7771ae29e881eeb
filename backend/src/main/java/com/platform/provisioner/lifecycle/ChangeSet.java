package com.platform.provisioner.lifecycle;

/**
 * Delta of mutable attributes submitted with an update.
 */
public interface ChangeSet {
    
    /**
     * False when nothing mutable changed, in which case no modify call is issued.
     */
    boolean hasChanges();
}
