package com.platform.provisioner.api;

import com.platform.provisioner.convergence.CancellationToken;
import com.platform.provisioner.lifecycle.LifecycleOrchestrator;
import com.platform.provisioner.lifecycle.LifecycleOutcome;
import com.platform.provisioner.lifecycle.ProvisioningExecutor;
import com.platform.provisioner.resource.endpoint.ClusterEndpoint;
import com.platform.provisioner.resource.endpoint.ClusterEndpointChanges;
import com.platform.provisioner.resource.endpoint.ClusterEndpointSpec;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * REST API for cluster endpoints.
 * <p>
 * Mutations run on the provisioning pool and block the request until the endpoint has
 * converged. Pass {@code X-Operation-ID} to be able to cancel a running mutation through
 * {@link OperationController}.
 */
@Slf4j
@RestController
@RequestMapping("/api/cluster-endpoints")
public class ClusterEndpointController {
    
    static final String OPERATION_ID_HEADER = "X-Operation-ID";
    
    private final LifecycleOrchestrator<ClusterEndpoint, ClusterEndpointSpec, ClusterEndpointChanges> orchestrator;
    private final ProvisioningExecutor executor;
    
    public ClusterEndpointController(
            LifecycleOrchestrator<ClusterEndpoint, ClusterEndpointSpec, ClusterEndpointChanges> orchestrator,
            ProvisioningExecutor executor) {
        this.orchestrator = orchestrator;
        this.executor = executor;
    }
    
    /**
     * Create an endpoint and wait until it is available.
     */
    @PostMapping
    public ResponseEntity<ResourceView<ClusterEndpoint>> create(
            @Valid @RequestBody ClusterEndpointSpec spec,
            @RequestHeader(value = OPERATION_ID_HEADER, required = false) String operationId) {
        
        log.info("Create request for endpoint {} on cluster {}", spec.endpointIdentifier(), spec.clusterIdentifier());
        LifecycleOutcome<ClusterEndpoint> outcome = run(operationId, token -> orchestrator.create(spec, token));
        outcome.throwIfFailed();
        
        return ResponseEntity.status(HttpStatus.CREATED).body(ResourceView.of(outcome));
    }
    
    /**
     * Current state of an endpoint; 404 once it no longer exists.
     */
    @GetMapping("/{id}")
    public ResourceView<ClusterEndpoint> read(@PathVariable String id) {
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.read(id);
        outcome.snapshotOrThrow();
        return ResourceView.of(outcome);
    }
    
    /**
     * Apply changes to the mutable attributes and wait until the endpoint is available again.
     */
    @PatchMapping("/{id}")
    public ResourceView<ClusterEndpoint> update(
            @PathVariable String id,
            @RequestBody ClusterEndpointChanges changes,
            @RequestHeader(value = OPERATION_ID_HEADER, required = false) String operationId) {
        
        LifecycleOutcome<ClusterEndpoint> outcome = run(operationId, token -> orchestrator.update(id, changes, token));
        outcome.snapshotOrThrow();
        return ResourceView.of(outcome);
    }
    
    /**
     * Delete an endpoint and wait until it is gone. Deleting an endpoint that no longer exists succeeds.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable String id,
            @RequestHeader(value = OPERATION_ID_HEADER, required = false) String operationId) {
        
        LifecycleOutcome<ClusterEndpoint> outcome = run(operationId, token -> orchestrator.delete(id, token));
        outcome.throwIfFailed();
        return ResponseEntity.noContent().build();
    }
    
    /**
     * Adopt an existing endpoint by identifier.
     */
    @PostMapping("/import/{id}")
    public ResourceView<ClusterEndpoint> importEndpoint(@PathVariable String id) {
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.importResource(id);
        outcome.throwIfFailed();
        return ResourceView.of(outcome);
    }
    
    private LifecycleOutcome<ClusterEndpoint> run(String operationId,
            Function<CancellationToken, LifecycleOutcome<ClusterEndpoint>> operation) {
        CompletableFuture<LifecycleOutcome<ClusterEndpoint>> future = operationId != null && !operationId.isBlank()
            ? executor.submit(operationId, operation)
            : executor.submit(operation);
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
