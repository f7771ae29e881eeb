package com.platform.provisioner.lifecycle;

import java.util.Set;

/**
 * Status vocabulary shared by resources whose control plane reports lower-case lifecycle states.
 */
public final class StatusLabels {
    
    public static final String CREATING = "creating";
    public static final String MODIFYING = "modifying";
    public static final String AVAILABLE = "available";
    public static final String DELETING = "deleting";
    
    /** Pending labels while waiting for a create or modify to settle. */
    public static final Set<String> PENDING_AVAILABLE = Set.of(CREATING, MODIFYING);
    public static final Set<String> TARGET_AVAILABLE = Set.of(AVAILABLE);
    
    /** Pending labels while waiting for a delete; the target is absence. */
    public static final Set<String> PENDING_DELETED = Set.of(DELETING);
    
    private StatusLabels() {
    }
}
