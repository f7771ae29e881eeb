package com.platform.provisioner.convergence;

import com.platform.provisioner.error.ConvergenceTimeoutException;
import com.platform.provisioner.error.OperationCancelledException;
import com.platform.provisioner.error.ResourceNotFoundException;
import com.platform.provisioner.error.UnexpectedStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polls a remote object until it reaches a target state, disappears, or the deadline passes.
 * <p>
 * Blocks the calling thread. The engine keeps no state between invocations, so independent
 * waits may run concurrently on separate threads.
 */
@Slf4j
@Component
public class ConvergenceEngine {
    
    static final String ABSENT_LABEL = "<absent>";
    
    private final Clock clock;
    
    public ConvergenceEngine(Clock clock) {
        this.clock = clock;
    }
    
    /**
     * Runs the poll loop.
     *
     * @return the last snapshot once a target label is observed, or a vanished result when absence was awaited
     * @throws UnexpectedStateException when a label outside pending and target is observed
     * @throws ConvergenceTimeoutException when the deadline passes while still pending
     * @throws OperationCancelledException when the caller cancels or interrupts the thread
     * @throws ResourceNotFoundException when the object stays absent past {@code notFoundChecks}
     */
    public <S> ConvergenceResult<S> await(ConvergenceRequest<S> request) {
        Instant start = clock.instant();
        Instant deadline = start.plus(request.timeout());
        PollBackoff backoff = PollBackoff.forRequest(request);
        String id = request.resourceId();
        
        log.debug("Waiting for {} {} to reach {} (pending: {}, timeout: {})", 
            request.resourceKind(), id, describeTarget(request), request.pending(), request.timeout());
        
        if (!request.delay().isZero()) {
            pause(request, min(request.delay(), remaining(deadline)));
        }
        
        int refreshCount = 0;
        int notFoundTicks = 0;
        int targetOccurrences = 0;
        String lastLabel = null;
        S lastSnapshot = null;
        
        while (true) {
            if (request.cancellation().isCancelled() || Thread.currentThread().isInterrupted()) {
                throw new OperationCancelledException(id);
            }
            
            RefreshResult<S> result = request.refresher().refresh();
            refreshCount++;
            
            if (!result.found()) {
                lastLabel = ABSENT_LABEL;
                lastSnapshot = null;
                
                if (request.awaitsAbsence()) {
                    targetOccurrences++;
                    if (targetOccurrences >= request.continuousTargetOccurrence()) {
                        Duration elapsed = Duration.between(start, clock.instant());
                        log.debug("{} {} is gone after {} refreshes ({})", 
                            request.resourceKind(), id, refreshCount, elapsed);
                        return ConvergenceResult.vanished(refreshCount, elapsed);
                    }
                } else {
                    targetOccurrences = 0;
                    notFoundTicks++;
                    if (notFoundTicks > request.notFoundChecks()) {
                        throw new ResourceNotFoundException(request.resourceKind(), id,
                            String.format("still absent after %d checks", notFoundTicks));
                    }
                    log.trace("{} {} not visible yet ({}/{})", 
                        request.resourceKind(), id, notFoundTicks, request.notFoundChecks());
                }
            } else {
                notFoundTicks = 0;
                String label = result.label();
                if (!label.equals(lastLabel)) {
                    log.debug("{} {} state: {} -> {}", request.resourceKind(), id, lastLabel, label);
                }
                lastLabel = label;
                lastSnapshot = result.snapshot();
                
                if (request.target().contains(label)) {
                    targetOccurrences++;
                    if (targetOccurrences >= request.continuousTargetOccurrence()) {
                        Duration elapsed = Duration.between(start, clock.instant());
                        log.debug("{} {} reached '{}' after {} refreshes ({})", 
                            request.resourceKind(), id, label, refreshCount, elapsed);
                        return ConvergenceResult.converged(label, lastSnapshot, refreshCount, elapsed);
                    }
                } else if (request.pending().contains(label)) {
                    targetOccurrences = 0;
                } else {
                    throw new UnexpectedStateException(id, label, request.pending(), request.target());
                }
            }
            
            Duration remaining = remaining(deadline);
            if (remaining.isZero()) {
                throw new ConvergenceTimeoutException(id, lastLabel, lastSnapshot, request.timeout());
            }
            pause(request, min(backoff.next(), remaining));
        }
    }
    
    private void pause(ConvergenceRequest<?> request, Duration wait) {
        if (request.cancellation().sleep(wait)) {
            log.debug("Wait for {} {} cancelled", request.resourceKind(), request.resourceId());
            throw new OperationCancelledException(request.resourceId());
        }
    }
    
    private Duration remaining(Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
    
    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
    
    private static String describeTarget(ConvergenceRequest<?> request) {
        return request.awaitsAbsence() ? "absence" : request.target().toString();
    }
}
