package com.platform.provisioner.lifecycle;

import com.platform.provisioner.config.ProvisionerProperties;
import com.platform.provisioner.convergence.CancellationToken;
import com.platform.provisioner.convergence.ConvergenceEngine;
import com.platform.provisioner.convergence.ConvergenceRequest;
import com.platform.provisioner.convergence.ConvergenceResult;
import com.platform.provisioner.convergence.StateRefresher;
import com.platform.provisioner.error.LifecycleOperationException;
import com.platform.provisioner.error.ProvisionerException;
import com.platform.provisioner.error.RemoteOperationException;
import com.platform.provisioner.error.ResourceNotFoundException;
import com.platform.provisioner.lookup.Lookup;
import com.platform.provisioner.lookup.RemoteOperation;
import com.platform.provisioner.observability.LoggingConfig;
import com.platform.provisioner.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sequences remote mutations with their convergence waits for one resource kind.
 * <ul>
 *   <li>create: remote create, wait for available, read back</li>
 *   <li>update: remote modify (only when something changed), wait for available, read back</li>
 *   <li>delete: remote delete, wait for absence</li>
 *   <li>read: single lookup, absence means the object was deleted out of band</li>
 * </ul>
 * Failures are returned as {@link LifecycleOutcome.Status#FAILED} outcomes carrying the
 * resource kind, identifier and operation.
 */
@Slf4j
public class LifecycleOrchestrator<S, C, U extends ChangeSet> {

    private final ManagedResource<S, C, U> resource;
    private final ConvergenceEngine engine;
    private final ProvisionerProperties.Convergence settings;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    public LifecycleOrchestrator(
            ManagedResource<S, C, U> resource,
            ConvergenceEngine engine,
            ProvisionerProperties.Convergence settings,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.resource = resource;
        this.engine = engine;
        this.settings = settings;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }

    public String kind() {
        return resource.kind();
    }

    public LifecycleOutcome<S> create(C spec) {
        return create(spec, CancellationToken.create());
    }

    /**
     * Creates the resource and waits until it is available.
     * If the wait fails, the outcome still carries the new identifier.
     */
    public LifecycleOutcome<S> create(C spec, CancellationToken cancellation) {
        Instant start = clock.instant();
        LoggingConfig.setOperationContext(LifecycleOperation.CREATE.label(), kind(), null);
        String id = null;
        AtomicInteger polls = new AtomicInteger();
        try {
            List<String> parts = resource.create(spec);
            id = resource.identifierCodec().encode(parts);
            LoggingConfig.setResourceId(id);
            log.info("Created {} {}, waiting for it to become available", kind(), id);

            awaitAvailable(LifecycleOperation.CREATE, id, polls, cancellation);

            Lookup<S> readBack = resource.find(id);
            if (!readBack.isFound()) {
                throw new ResourceNotFoundException(kind(), id, "not found after creation");
            }
            return succeeded(LifecycleOperation.CREATE, id, readBack.snapshot(), polls.get(), start);
        } catch (ProvisionerException e) {
            return failed(LifecycleOperation.CREATE, id, e, polls.get(), start);
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }

    /**
     * Single lookup. An absent object yields an {@code ABSENT} outcome so the caller can drop its record.
     */
    public LifecycleOutcome<S> read(String id) {
        Instant start = clock.instant();
        LoggingConfig.setOperationContext(LifecycleOperation.READ.label(), kind(), id);
        try {
            Lookup<S> lookup = resource.find(id);
            if (!lookup.isFound()) {
                log.warn("{} {} not found ({}), removing from tracked state", kind(), id, lookup.notFoundReason());
                return vanished(LifecycleOperation.READ, id, 0, start);
            }
            return succeeded(LifecycleOperation.READ, id, lookup.snapshot(), 0, start);
        } catch (ProvisionerException e) {
            return failed(LifecycleOperation.READ, id, e, 0, start);
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }

    /**
     * Adopts an existing object by identifier. Unlike read, absence is a failure.
     */
    public LifecycleOutcome<S> importResource(String id) {
        Instant start = clock.instant();
        LoggingConfig.setOperationContext(LifecycleOperation.IMPORT.label(), kind(), id);
        try {
            Lookup<S> lookup = resource.find(id);
            if (!lookup.isFound()) {
                throw new ResourceNotFoundException(kind(), id, lookup.notFoundReason());
            }
            log.info("Imported {} {}", kind(), id);
            return succeeded(LifecycleOperation.IMPORT, id, lookup.snapshot(), 0, start);
        } catch (ProvisionerException e) {
            return failed(LifecycleOperation.IMPORT, id, e, 0, start);
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }

    public LifecycleOutcome<S> update(String id, U changes) {
        return update(id, changes, CancellationToken.create());
    }

    /**
     * Applies the change set and waits until the resource is available again.
     * An empty change set only reads the current state.
     */
    public LifecycleOutcome<S> update(String id, U changes, CancellationToken cancellation) {
        if (!changes.hasChanges()) {
            log.debug("No mutable attribute changed for {} {}, skipping modify", kind(), id);
            return read(id);
        }

        Instant start = clock.instant();
        LoggingConfig.setOperationContext(LifecycleOperation.UPDATE.label(), kind(), id);
        AtomicInteger polls = new AtomicInteger();
        try {
            List<String> parts = resource.identifierCodec().decode(id);
            resource.modify(parts, changes);
            log.info("Modified {} {}, waiting for it to become available", kind(), id);

            awaitAvailable(LifecycleOperation.UPDATE, id, polls, cancellation);

            Lookup<S> readBack = resource.find(id);
            if (!readBack.isFound()) {
                throw new ResourceNotFoundException(kind(), id, "not found after update");
            }
            return succeeded(LifecycleOperation.UPDATE, id, readBack.snapshot(), polls.get(), start);
        } catch (ProvisionerException e) {
            return failed(LifecycleOperation.UPDATE, id, e, polls.get(), start);
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }

    public LifecycleOutcome<S> delete(String id) {
        return delete(id, CancellationToken.create());
    }

    /**
     * Deletes the resource and waits until it can no longer be found.
     * A delete rejected because the object is already gone succeeds without polling.
     */
    public LifecycleOutcome<S> delete(String id, CancellationToken cancellation) {
        Instant start = clock.instant();
        LoggingConfig.setOperationContext(LifecycleOperation.DELETE.label(), kind(), id);
        AtomicInteger polls = new AtomicInteger();
        try {
            List<String> parts = resource.identifierCodec().decode(id);
            try {
                resource.delete(parts);
            } catch (RemoteOperationException e) {
                if (resource.absenceRules().isAbsent(RemoteOperation.DELETE, e)) {
                    log.info("{} {} already gone ({})", kind(), id, e.getRemoteErrorCode());
                    return vanished(LifecycleOperation.DELETE, id, 0, start);
                }
                throw e;
            }

            log.info("Deleting {} {}, waiting for it to disappear", kind(), id);
            try {
                ConvergenceResult<S> converged = engine.await(convergenceRequest(id,
                    StatusLabels.PENDING_DELETED, Set.of(), settings.getDeletedTimeout(), polls, cancellation));
                metricsRegistry.recordConvergence(kind(), LifecycleOperation.DELETE.label(), "absent",
                    converged.refreshCount());
                return vanished(LifecycleOperation.DELETE, id, converged.refreshCount(), start);
            } catch (RemoteOperationException e) {
                if (resource.absenceRules().isAbsent(RemoteOperation.DELETE, e)) {
                    log.info("{} {} reported gone while waiting ({})", kind(), id, e.getRemoteErrorCode());
                    metricsRegistry.recordConvergence(kind(), LifecycleOperation.DELETE.label(), "absent", polls.get());
                    return vanished(LifecycleOperation.DELETE, id, polls.get(), start);
                }
                recordConvergenceFailure(LifecycleOperation.DELETE, e, polls.get());
                throw e;
            } catch (ProvisionerException e) {
                recordConvergenceFailure(LifecycleOperation.DELETE, e, polls.get());
                throw e;
            }
        } catch (ProvisionerException e) {
            return failed(LifecycleOperation.DELETE, id, e, polls.get(), start);
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }

    private ConvergenceResult<S> awaitAvailable(LifecycleOperation operation, String id, AtomicInteger polls,
            CancellationToken cancellation) {
        Duration timeout = settings.getAvailableTimeout();
        try {
            ConvergenceResult<S> result = engine.await(convergenceRequest(id,
                StatusLabels.PENDING_AVAILABLE, StatusLabels.TARGET_AVAILABLE, timeout, polls, cancellation));
            metricsRegistry.recordConvergence(kind(), operation.label(), "converged", result.refreshCount());
            return result;
        } catch (ProvisionerException e) {
            recordConvergenceFailure(operation, e, polls.get());
            throw e;
        }
    }

    /**
     * The refresher counts its calls into {@code polls} so failed waits still report how often they polled.
     */
    private ConvergenceRequest<S> convergenceRequest(String id, Set<String> pending, Set<String> target,
            Duration timeout, AtomicInteger polls, CancellationToken cancellation) {
        StateRefresher<S> refresher = StateRefresher.of(id, resource, resource.statusExtractor());
        return ConvergenceRequest.<S>builder()
            .resourceKind(kind())
            .resourceId(id)
            .pending(pending)
            .target(target)
            .refresher(() -> {
                polls.incrementAndGet();
                return refresher.refresh();
            })
            .timeout(timeout)
            .delay(settings.getDelay())
            .pollInterval(settings.getPollInterval())
            .minBackoff(settings.getMinBackoff())
            .maxBackoff(settings.getMaxBackoff())
            .notFoundChecks(settings.getNotFoundChecks())
            .continuousTargetOccurrence(settings.getContinuousTargetOccurrence())
            .cancellation(cancellation)
            .build();
    }

    private void recordConvergenceFailure(LifecycleOperation operation, ProvisionerException e, int polls) {
        metricsRegistry.recordConvergence(kind(), operation.label(), e.getErrorCode().name().toLowerCase(Locale.ROOT),
            polls);
    }

    private LifecycleOutcome<S> succeeded(LifecycleOperation operation, String id, S snapshot, int polls,
            Instant start) {
        Duration elapsed = Duration.between(start, clock.instant());
        metricsRegistry.recordLifecycleOperation(kind(), operation.label(), "available", elapsed);
        log.info("{} {} {} succeeded after {} polls ({}ms)", operation.label(), kind(), id, polls, elapsed.toMillis());
        return LifecycleOutcome.available(kind(), operation, id, snapshot, polls, elapsed);
    }

    private LifecycleOutcome<S> vanished(LifecycleOperation operation, String id, int polls, Instant start) {
        Duration elapsed = Duration.between(start, clock.instant());
        metricsRegistry.recordLifecycleOperation(kind(), operation.label(), "absent", elapsed);
        return LifecycleOutcome.absent(kind(), operation, id, polls, elapsed);
    }

    private LifecycleOutcome<S> failed(LifecycleOperation operation, String id, ProvisionerException cause,
            int polls, Instant start) {
        Duration elapsed = Duration.between(start, clock.instant());
        LifecycleOperationException failure = new LifecycleOperationException(kind(), id, operation.label(), cause);
        metricsRegistry.recordLifecycleOperation(kind(), operation.label(), "failed", elapsed);

        if (cause.isFatal()) {
            log.error("{} failed [{}]: {}", operation.label(), cause.getErrorCode().getCode(), failure.getMessage());
        } else {
            log.warn("{} failed [{}]: {}", operation.label(), cause.getErrorCode().getCode(), failure.getMessage());
        }
        return LifecycleOutcome.failed(kind(), operation, id, failure, polls, elapsed);
    }
}
