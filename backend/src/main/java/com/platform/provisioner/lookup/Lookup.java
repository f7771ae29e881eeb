package com.platform.provisioner.lookup;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single describe call: either the current snapshot or an explicit "does not exist".
 * Absence is not an error; what it means is up to the caller.
 */
public record Lookup<S>(S snapshot, String notFoundReason) {
    
    public Lookup {
        if (snapshot == null && notFoundReason == null) {
            throw new IllegalArgumentException("a lookup is either found or carries a not-found reason");
        }
    }
    
    public static <S> Lookup<S> found(S snapshot) {
        return new Lookup<>(Objects.requireNonNull(snapshot, "snapshot"), null);
    }
    
    public static <S> Lookup<S> notFound(String reason) {
        return new Lookup<>(null, Objects.requireNonNull(reason, "reason"));
    }
    
    public boolean isFound() {
        return snapshot != null;
    }
    
    public Optional<S> asOptional() {
        return Optional.ofNullable(snapshot);
    }
}
