package com.platform.provisioner.convergence;

import java.util.Objects;

/**
 * One observation made by a {@link StateRefresher}: a status label with its snapshot, or absence.
 */
public record RefreshResult<S>(String label, S snapshot, boolean found) {
    
    public static <S> RefreshResult<S> observed(String label, S snapshot) {
        return new RefreshResult<>(Objects.requireNonNull(label, "label"), snapshot, true);
    }
    
    public static <S> RefreshResult<S> absent() {
        return new RefreshResult<>(null, null, false);
    }
}
