package com.platform.provisioner.lifecycle;

import com.platform.provisioner.convergence.CancellationToken;
import com.platform.provisioner.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Runs orchestrated operations on the provisioning worker pool.
 * <p>
 * Each submitted operation gets its own {@link CancellationToken}, registered under the
 * operation id until the operation finishes, so another caller can cancel it.
 */
@Slf4j
@Component
public class ProvisioningExecutor {

    private final TaskExecutor taskExecutor;
    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    public ProvisioningExecutor(@Qualifier("provisioningTaskExecutor") TaskExecutor taskExecutor) {
        this.taskExecutor = taskExecutor;
    }

    /**
     * Submit under a generated operation id.
     */
    public <S> CompletableFuture<LifecycleOutcome<S>> submit(Function<CancellationToken, LifecycleOutcome<S>> operation) {
        return submit(UUID.randomUUID().toString(), operation);
    }

    /**
     * Submit an operation.
     *
     * @throws ValidationException when an operation with the same id is still running
     */
    public <S> CompletableFuture<LifecycleOutcome<S>> submit(String operationId,
            Function<CancellationToken, LifecycleOutcome<S>> operation) {
        CancellationToken token = CancellationToken.create();
        if (inFlight.putIfAbsent(operationId, token) != null) {
            throw new ValidationException(String.format("operation %s is already running", operationId));
        }

        log.debug("Submitting operation {}", operationId);
        try {
            return CompletableFuture.supplyAsync(() -> operation.apply(token), taskExecutor)
                .whenComplete((outcome, error) -> {
                    inFlight.remove(operationId, token);
                    if (error != null) {
                        log.error("Operation {} terminated abnormally: {}", operationId, error.getMessage(), error);
                    } else {
                        log.debug("Operation {} finished with {}", operationId, outcome.status());
                    }
                });
        } catch (RuntimeException e) {
            // pool rejected the task
            inFlight.remove(operationId, token);
            throw e;
        }
    }

    /**
     * Cancel a running operation. Its wait ends with an operation-cancelled failure.
     *
     * @return false when no operation with that id is running
     */
    public boolean cancel(String operationId) {
        CancellationToken token = inFlight.get(operationId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling operation {}", operationId);
        token.cancel();
        return true;
    }

    public Set<String> inFlight() {
        return new TreeSet<>(inFlight.keySet());
    }
}
