package com.platform.provisioner.convergence;

import java.time.Duration;

/**
 * Successful end of a wait: either the object reached a target label, or it is gone.
 */
public record ConvergenceResult<S>(S snapshot, String label, boolean absent, int refreshCount, Duration elapsed) {
    
    public static <S> ConvergenceResult<S> converged(String label, S snapshot, int refreshCount, Duration elapsed) {
        return new ConvergenceResult<>(snapshot, label, false, refreshCount, elapsed);
    }
    
    public static <S> ConvergenceResult<S> vanished(int refreshCount, Duration elapsed) {
        return new ConvergenceResult<>(null, null, true, refreshCount, elapsed);
    }
}
