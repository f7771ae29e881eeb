package com.platform.provisioner.convergence;

import com.platform.provisioner.error.ErrorCode;
import com.platform.provisioner.error.ValidationException;
import lombok.Builder;

import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Parameters of one polling operation.
 * <p>
 * An empty {@code target} means the object must become undetectable. Pending and target
 * labels must be disjoint. Optional knobs fall back to the defaults below when left null or zero.
 *
 * @param resourceKind                kind used in diagnostics
 * @param resourceId                  identifier used in diagnostics
 * @param pending                     labels meaning "still in progress"
 * @param target                      labels meaning "done"; empty for absence waits
 * @param refresher                   reads the current state
 * @param timeout                     overall deadline, must be positive
 * @param delay                       wait before the first refresh
 * @param pollInterval                fixed wait between refreshes; null selects exponential backoff
 * @param minBackoff                  first backoff wait
 * @param maxBackoff                  backoff cap
 * @param notFoundChecks              consecutive absences tolerated while a non-empty target is awaited
 * @param continuousTargetOccurrence  consecutive target observations required for success
 * @param cancellation                caller cancellation signal
 */
@Builder
public record ConvergenceRequest<S>(
    String resourceKind,
    String resourceId,
    Set<String> pending,
    Set<String> target,
    StateRefresher<S> refresher,
    Duration timeout,
    Duration delay,
    Duration pollInterval,
    Duration minBackoff,
    Duration maxBackoff,
    int notFoundChecks,
    int continuousTargetOccurrence,
    CancellationToken cancellation
) {
    
    public static final Duration DEFAULT_MIN_BACKOFF = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);
    public static final int DEFAULT_NOT_FOUND_CHECKS = 20;
    
    public ConvergenceRequest {
        Objects.requireNonNull(refresher, "refresher");
        resourceKind = resourceKind != null ? resourceKind : "resource";
        resourceId = resourceId != null ? resourceId : "unknown";
        pending = pending != null ? Set.copyOf(pending) : Set.of();
        target = target != null ? Set.copyOf(target) : Set.of();
        delay = delay != null ? delay : Duration.ZERO;
        minBackoff = minBackoff != null ? minBackoff : DEFAULT_MIN_BACKOFF;
        maxBackoff = maxBackoff != null ? maxBackoff : DEFAULT_MAX_BACKOFF;
        notFoundChecks = notFoundChecks > 0 ? notFoundChecks : DEFAULT_NOT_FOUND_CHECKS;
        continuousTargetOccurrence = Math.max(continuousTargetOccurrence, 1);
        cancellation = cancellation != null ? cancellation : CancellationToken.create();
        
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw invalid("timeout", timeout, "must be positive");
        }
        if (delay.isNegative()) {
            throw invalid("delay", delay, "must not be negative");
        }
        if (pollInterval != null && (pollInterval.isNegative() || pollInterval.isZero())) {
            throw invalid("pollInterval", pollInterval, "must be positive when set");
        }
        if (minBackoff.isNegative() || minBackoff.isZero() || minBackoff.compareTo(maxBackoff) > 0) {
            throw invalid("minBackoff", minBackoff, "must be positive and not exceed maxBackoff " + maxBackoff);
        }
        
        Set<String> overlap = new HashSet<>(pending);
        overlap.retainAll(target);
        if (!overlap.isEmpty()) {
            throw invalid("target", target, "overlaps pending labels " + overlap);
        }
    }
    
    /**
     * True when success means the object has disappeared.
     */
    public boolean awaitsAbsence() {
        return target.isEmpty();
    }
    
    private static ValidationException invalid(String field, Object value, String message) {
        return new ValidationException(ErrorCode.INVALID_CONVERGENCE_REQUEST, field, value, message);
    }
}
