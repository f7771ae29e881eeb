package com.platform.provisioner.lookup;

import com.platform.provisioner.error.RemoteOperationException;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per resource kind table of remote error codes that mean "the object is already gone".
 * <p>
 * Kept per operation: a code that is tolerable for a delete is not automatically
 * tolerable for a describe.
 */
public final class AbsenceRules {
    
    private final Map<RemoteOperation, Set<String>> absentCodes;
    
    private AbsenceRules(Map<RemoteOperation, Set<String>> absentCodes) {
        this.absentCodes = absentCodes;
    }
    
    public static AbsenceRules none() {
        return new AbsenceRules(Map.of());
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Checks whether the failure of the given operation signals absence of the object.
     */
    public boolean isAbsent(RemoteOperation operation, Throwable failure) {
        if (!(failure instanceof RemoteOperationException remote) || remote.getRemoteErrorCode() == null) {
            return false;
        }
        return codesFor(operation).contains(remote.getRemoteErrorCode());
    }
    
    public Set<String> codesFor(RemoteOperation operation) {
        return absentCodes.getOrDefault(operation, Set.of());
    }
    
    @Override
    public String toString() {
        return "AbsenceRules" + absentCodes;
    }
    
    public static final class Builder {
        
        private final Map<RemoteOperation, Set<String>> codes = new EnumMap<>(RemoteOperation.class);
        
        private Builder() {
        }
        
        public Builder absentOn(RemoteOperation operation, Collection<String> errorCodes) {
            codes.put(operation, Set.copyOf(errorCodes));
            return this;
        }
        
        public Builder absentOn(RemoteOperation operation, String... errorCodes) {
            return absentOn(operation, List.of(errorCodes));
        }
        
        public AbsenceRules build() {
            return new AbsenceRules(Map.copyOf(codes));
        }
    }
}
