package com.platform.provisioner.lookup;

import java.util.Locale;

/**
 * The four logical calls a remote control plane offers for a resource.
 */
public enum RemoteOperation {
    CREATE,
    MODIFY,
    DELETE,
    DESCRIBE;
    
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
