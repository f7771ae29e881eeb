package com.platform.provisioner.convergence;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-initiated cancellation signal for a blocking wait.
 * Sleeping through {@link #sleep(Duration)} wakes up as soon as the token is cancelled.
 */
public final class CancellationToken {
    
    private final CountDownLatch cancelled = new CountDownLatch(1);
    
    public static CancellationToken create() {
        return new CancellationToken();
    }
    
    public void cancel() {
        cancelled.countDown();
    }
    
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
    
    /**
     * Sleeps for up to the given duration.
     * An interrupt of the calling thread counts as cancellation; the interrupt flag is restored.
     *
     * @return true when the sleep ended because of cancellation
     */
    public boolean sleep(Duration duration) {
        try {
            return cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
