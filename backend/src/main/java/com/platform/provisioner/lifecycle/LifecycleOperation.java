package com.platform.provisioner.lifecycle;

import java.util.Locale;

/**
 * Operations the orchestrator performs on a resource.
 */
public enum LifecycleOperation {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    IMPORT;
    
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
