package com.platform.provisioner.lifecycle;

import com.platform.provisioner.convergence.CancellationToken;
import com.platform.provisioner.error.ErrorCode;
import com.platform.provisioner.error.LifecycleOperationException;
import com.platform.provisioner.error.OperationCancelledException;
import com.platform.provisioner.error.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class ProvisioningExecutorTest {
    
    private ThreadPoolTaskExecutor taskExecutor;
    private ProvisioningExecutor executor;
    
    @BeforeEach
    void setUp() {
        taskExecutor = new ThreadPoolTaskExecutor();
        taskExecutor.setCorePoolSize(2);
        taskExecutor.setMaxPoolSize(2);
        taskExecutor.setThreadNamePrefix("provision-test-");
        taskExecutor.initialize();
        executor = new ProvisioningExecutor(taskExecutor);
    }
    
    @AfterEach
    void tearDown() {
        taskExecutor.shutdown();
    }
    
    /**
     * Blocks until cancelled, then reports the cancellation the way the orchestrator does.
     */
    private static LifecycleOutcome<String> waitForCancellation(CancellationToken token, CountDownLatch started) {
        started.countDown();
        if (token.sleep(Duration.ofSeconds(30))) {
            LifecycleOperationException failure = new LifecycleOperationException(
                "cluster-endpoint", "prod:readers", "delete", new OperationCancelledException("prod:readers"));
            return LifecycleOutcome.failed("cluster-endpoint", LifecycleOperation.DELETE, "prod:readers",
                failure, 1, Duration.ZERO);
        }
        return LifecycleOutcome.absent("cluster-endpoint", LifecycleOperation.DELETE, "prod:readers", 1, Duration.ZERO);
    }
    
    @Test
    void runsOperationOnThePool() {
        CompletableFuture<LifecycleOutcome<String>> future = executor.submit("op-1", token ->
            LifecycleOutcome.available("cluster-endpoint", LifecycleOperation.READ, "prod:readers",
                Thread.currentThread().getName(), 0, Duration.ZERO));
        
        LifecycleOutcome<String> outcome = future.join();
        
        assertThat(outcome.snapshot()).startsWith("provision-test-");
    }
    
    @Test
    void cancelTriggersTheOperationToken() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<LifecycleOutcome<String>> future = 
            executor.submit("op-2", token -> waitForCancellation(token, started));
        started.await();
        
        assertThat(executor.inFlight()).containsExactly("op-2");
        assertThat(executor.cancel("op-2")).isTrue();
        
        LifecycleOutcome<String> outcome = future.join();
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.FAILED);
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.OPERATION_CANCELLED);
    }
    
    @Test
    void finishedOperationsAreForgotten() {
        executor.submit("op-3", token -> 
            LifecycleOutcome.<String>absent("cluster-endpoint", LifecycleOperation.DELETE, "prod:readers", 0, Duration.ZERO))
            .join();
        
        assertThat(executor.inFlight()).isEmpty();
        assertThat(executor.cancel("op-3")).isFalse();
    }
    
    @Test
    void finishedOperationIdCanBeReused() throws Exception {
        executor.submit("op-5", token ->
            LifecycleOutcome.<String>absent("cluster-endpoint", LifecycleOperation.DELETE, "prod:readers", 0, Duration.ZERO))
            .join();
        
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<LifecycleOutcome<String>> second = executor.submit("op-5", token -> waitForCancellation(token, started));
        started.await();
        
        assertThat(executor.inFlight()).containsExactly("op-5");
        assertThat(executor.cancel("op-5")).isTrue();
        assertThat(second.join().failure().getErrorCode()).isEqualTo(ErrorCode.OPERATION_CANCELLED);
        assertThat(executor.inFlight()).isEmpty();
    }
    
    @Test
    void rejectedSubmissionReleasesItsId() {
        ProvisioningExecutor saturated = new ProvisioningExecutor(task -> {
            throw new RejectedExecutionException("queue full");
        });
        
        assertThatThrownBy(() -> saturated.submit("op-6", token ->
                LifecycleOutcome.<String>absent("cluster-endpoint", LifecycleOperation.DELETE, "prod:readers", 0, Duration.ZERO)))
            .isInstanceOf(RejectedExecutionException.class);
        assertThat(saturated.inFlight()).isEmpty();
    }
    
    @Test
    void rejectsDuplicateOperationIds() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        executor.submit("op-4", token -> waitForCancellation(token, started));
        started.await();
        
        assertThatThrownBy(() -> executor.submit("op-4", token -> waitForCancellation(token, new CountDownLatch(1))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("op-4");
        
        executor.cancel("op-4");
    }
    
    @Test
    void generatesOperationIdWhenNoneGiven() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<LifecycleOutcome<String>> future = executor.submit(token -> waitForCancellation(token, started));
        started.await();
        
        assertThat(executor.inFlight()).hasSize(1);
        executor.inFlight().forEach(executor::cancel);
        assertThat(future.join().isSuccess()).isFalse();
    }
}
