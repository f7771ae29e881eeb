package com.platform.provisioner.lookup;

import java.util.function.Function;

/**
 * Projects a snapshot onto the coarse status label used by convergence.
 */
@FunctionalInterface
public interface StatusExtractor<S> {
    
    String UNKNOWN = "unknown";
    
    /**
     * Never fails; a snapshot without a meaningful status yields {@link #UNKNOWN}.
     */
    String extract(S snapshot);
    
    /**
     * Wraps an attribute accessor so null or blank statuses become {@link #UNKNOWN}.
     */
    static <S> StatusExtractor<S> of(Function<S, String> statusAccessor) {
        return snapshot -> {
            if (snapshot == null) {
                return UNKNOWN;
            }
            String status = statusAccessor.apply(snapshot);
            return status == null || status.isBlank() ? UNKNOWN : status;
        };
    }
}
