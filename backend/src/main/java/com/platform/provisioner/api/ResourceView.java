package com.platform.provisioner.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.provisioner.lifecycle.LifecycleOutcome;

import java.util.Locale;

/**
 * REST representation of a successful lifecycle outcome.
 *
 * @param id        identifier to persist for later read, update and delete calls
 * @param kind      resource kind
 * @param operation operation that produced this view
 * @param status    {@code available} or {@code absent}
 * @param polls     refreshes spent waiting for convergence
 * @param elapsedMs wall time of the operation
 * @param resource  current snapshot, absent after a delete
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceView<S>(
    String id,
    String kind,
    String operation,
    String status,
    int polls,
    long elapsedMs,
    S resource
) {
    
    public static <S> ResourceView<S> of(LifecycleOutcome<S> outcome) {
        return new ResourceView<>(
            outcome.resourceId(),
            outcome.resourceKind(),
            outcome.operation().label(),
            outcome.status().name().toLowerCase(Locale.ROOT),
            outcome.polls(),
            outcome.elapsed().toMillis(),
            outcome.snapshot());
    }
}
