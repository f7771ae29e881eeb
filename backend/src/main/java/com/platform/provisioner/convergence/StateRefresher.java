package com.platform.provisioner.convergence;

import com.platform.provisioner.lookup.Lookup;
import com.platform.provisioner.lookup.ResourceFinder;
import com.platform.provisioner.lookup.StatusExtractor;

/**
 * Re-reads the current state of a remote object. Called repeatedly by the convergence engine,
 * so implementations must be pure queries that keep no state between calls.
 * <p>
 * Absence is reported through {@link RefreshResult#absent()}; any exception thrown is fatal
 * to the wait.
 */
@FunctionalInterface
public interface StateRefresher<S> {
    
    RefreshResult<S> refresh();
    
    /**
     * Builds a refresher from a finder and a status extractor.
     */
    static <S> StateRefresher<S> of(String id, ResourceFinder<S> finder, StatusExtractor<S> statusExtractor) {
        return () -> {
            Lookup<S> lookup = finder.find(id);
            if (!lookup.isFound()) {
                return RefreshResult.absent();
            }
            return RefreshResult.observed(statusExtractor.extract(lookup.snapshot()), lookup.snapshot());
        };
    }
}
