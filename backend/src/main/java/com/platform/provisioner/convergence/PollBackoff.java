package com.platform.provisioner.convergence;

import java.time.Duration;

/**
 * Wait between two refreshes: a fixed interval when one is configured,
 * otherwise exponential growth from the minimum, capped at the maximum.
 */
final class PollBackoff {
    
    private static final long MULTIPLIER = 2;
    
    private final Duration fixedInterval;
    private final Duration maxWait;
    private Duration nextWait;
    
    PollBackoff(Duration fixedInterval, Duration minWait, Duration maxWait) {
        this.fixedInterval = fixedInterval;
        this.maxWait = maxWait;
        this.nextWait = minWait;
    }
    
    static PollBackoff forRequest(ConvergenceRequest<?> request) {
        return new PollBackoff(request.pollInterval(), request.minBackoff(), request.maxBackoff());
    }
    
    Duration next() {
        if (fixedInterval != null) {
            return fixedInterval;
        }
        
        Duration current = nextWait;
        Duration grown = nextWait.multipliedBy(MULTIPLIER);
        nextWait = grown.compareTo(maxWait) > 0 ? maxWait : grown;
        return current;
    }
}
