package com.platform.provisioner.lifecycle;

import com.platform.provisioner.config.ProvisionerProperties;
import com.platform.provisioner.convergence.CancellationToken;
import com.platform.provisioner.convergence.ConvergenceEngine;
import com.platform.provisioner.error.ConvergenceTimeoutException;
import com.platform.provisioner.error.ErrorCode;
import com.platform.provisioner.error.LifecycleOperationException;
import com.platform.provisioner.error.RemoteOperationException;
import com.platform.provisioner.error.ResourceNotFoundException;
import com.platform.provisioner.error.UnexpectedStateException;
import com.platform.provisioner.lookup.AbsenceRules;
import com.platform.provisioner.lookup.RemoteOperation;
import com.platform.provisioner.observability.MetricsRegistry;
import com.platform.provisioner.resource.endpoint.ClusterEndpoint;
import com.platform.provisioner.resource.endpoint.ClusterEndpointApi;
import com.platform.provisioner.resource.endpoint.ClusterEndpointChanges;
import com.platform.provisioner.resource.endpoint.ClusterEndpointResource;
import com.platform.provisioner.resource.endpoint.ClusterEndpointSpec;
import com.platform.provisioner.resource.endpoint.EndpointType;
import com.platform.provisioner.resource.endpoint.FakeClusterEndpointApi;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.platform.provisioner.resource.endpoint.FakeClusterEndpointApi.ENDPOINT_NOT_FOUND;
import static com.platform.provisioner.resource.endpoint.FakeClusterEndpointApi.GONE;
import static org.assertj.core.api.Assertions.assertThat;

class LifecycleOrchestratorTest {
    
    private static final String ID = "prod:readers";
    private static final ClusterEndpointSpec SPEC = new ClusterEndpointSpec(
        "prod", "readers", EndpointType.READER, List.of("prod-1"), null);
    
    private FakeClusterEndpointApi api;
    private SimpleMeterRegistry meterRegistry;
    private ProvisionerProperties.Convergence settings;
    private LifecycleOrchestrator<ClusterEndpoint, ClusterEndpointSpec, ClusterEndpointChanges> orchestrator;
    
    @BeforeEach
    void setUp() {
        api = new FakeClusterEndpointApi();
        meterRegistry = new SimpleMeterRegistry();
        settings = new ProvisionerProperties.Convergence();
        settings.setPollInterval(Duration.ofMillis(1));
        settings.setAvailableTimeout(Duration.ofSeconds(5));
        settings.setDeletedTimeout(Duration.ofSeconds(5));
        orchestrator = orchestrator(settings);
    }
    
    private LifecycleOrchestrator<ClusterEndpoint, ClusterEndpointSpec, ClusterEndpointChanges> orchestrator(
            ProvisionerProperties.Convergence convergence) {
        return orchestrator(api, convergence, AbsenceRules.builder()
            .absentOn(RemoteOperation.DESCRIBE, ENDPOINT_NOT_FOUND, "DBClusterNotFoundFault")
            .absentOn(RemoteOperation.DELETE, ENDPOINT_NOT_FOUND, "DBClusterNotFoundFault")
            .build());
    }
    
    private LifecycleOrchestrator<ClusterEndpoint, ClusterEndpointSpec, ClusterEndpointChanges> orchestrator(
            ClusterEndpointApi endpointApi, ProvisionerProperties.Convergence convergence, AbsenceRules rules) {
        return new LifecycleOrchestrator<>(
            new ClusterEndpointResource(endpointApi, rules),
            new ConvergenceEngine(Clock.systemUTC()),
            convergence,
            new MetricsRegistry(meterRegistry),
            Clock.systemUTC());
    }
    
    // ==================== Create ====================
    
    @Test
    void createWaitsUntilAvailable() {
        api.script("readers", "creating", "creating", "available");
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.create(SPEC);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.AVAILABLE);
        assertThat(outcome.operation()).isEqualTo(LifecycleOperation.CREATE);
        assertThat(outcome.resourceId()).isEqualTo(ID);
        assertThat(outcome.polls()).isEqualTo(3);
        assertThat(outcome.snapshot().status()).isEqualTo("available");
        assertThat(outcome.snapshot().staticMembers()).containsExactly("prod-1");
        // three polls plus the read-back
        assertThat(api.describeCalls()).isEqualTo(4);
    }
    
    @Test
    void failedWaitStillReportsTheNewIdentifier() {
        api.script("readers", "creating", "incompatible-parameters");
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.create(SPEC);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.FAILED);
        assertThat(outcome.resourceId()).isEqualTo(ID);
        assertThat(outcome.polls()).isEqualTo(2);
        LifecycleOperationException failure = outcome.failure();
        assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.UNEXPECTED_STATE);
        assertThat(failure.getResourceKind()).isEqualTo(ClusterEndpointResource.KIND);
        assertThat(failure.getResourceId()).isEqualTo(ID);
        assertThat(failure.getOperation()).isEqualTo("create");
        assertThat(failure.getCause()).isInstanceOf(UnexpectedStateException.class);
    }
    
    @Test
    void createResponseWithoutIdentifierIsAFailedOutcome() {
        FakeClusterEndpointApi anonymousCreates = new FakeClusterEndpointApi() {
            @Override
            public synchronized ClusterEndpoint createEndpoint(ClusterEndpointSpec spec) {
                return new ClusterEndpoint(null, spec.endpointIdentifier(), spec.endpointType(), null,
                    "creating", null, null, null);
            }
        };
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator(anonymousCreates, settings, AbsenceRules.none())
            .create(SPEC);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.FAILED);
        assertThat(outcome.resourceId()).isNull();
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.REMOTE_RESPONSE_INVALID);
        assertThat(anonymousCreates.describeCalls()).isZero();
    }
    
    @Test
    void rejectedCreateHasNoIdentifier() {
        api.failCreateWith(RemoteOperationException.fromResponse(
            "create", 400, "DBClusterEndpointAlreadyExistsFault", "readers already exists"));
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.create(SPEC);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.FAILED);
        assertThat(outcome.resourceId()).isNull();
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.REMOTE_OPERATION_FAILED);
        assertThat(outcome.failure()).hasMessageContaining("DBClusterEndpointAlreadyExistsFault");
        assertThat(api.describeCalls()).isZero();
    }
    
    @Test
    void cancelledCreateStopsBeforePolling() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.create(SPEC, token);
        
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.OPERATION_CANCELLED);
        assertThat(outcome.resourceId()).isEqualTo(ID);
        assertThat(api.describeCalls()).isZero();
    }
    
    // ==================== Read / Import ====================
    
    @Test
    void readReturnsCurrentSnapshot() {
        api.existing("prod", "readers", "available");
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.read(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.AVAILABLE);
        assertThat(outcome.snapshotOrThrow().endpointIdentifier()).isEqualTo("readers");
        assertThat(outcome.polls()).isZero();
    }
    
    @Test
    void readOfMissingEndpointIsAbsentNotAnError() {
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.read(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.ABSENT);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.failure()).isNull();
    }
    
    @Test
    void readOfEndpointInAnotherClusterIsAbsent() {
        api.existing("staging", "readers", "available");
        
        assertThat(orchestrator.read(ID).isAbsent()).isTrue();
    }
    
    @Test
    void readWithMalformedIdentifierFails() {
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.read("readers");
        
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.MALFORMED_IDENTIFIER);
        assertThat(api.describeCalls()).isZero();
    }
    
    @Test
    void importAdoptsExistingEndpoint() {
        api.existing("prod", "readers", "available");
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.importResource(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.AVAILABLE);
        assertThat(outcome.operation()).isEqualTo(LifecycleOperation.IMPORT);
    }
    
    @Test
    void importOfMissingEndpointFails() {
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.importResource(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.FAILED);
        assertThat(outcome.failure().getCause()).isInstanceOf(ResourceNotFoundException.class);
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.RESOURCE_NOT_FOUND);
    }
    
    // ==================== Update ====================
    
    @Test
    void updateWithoutChangesOnlyReads() {
        api.existing("prod", "readers", "available");
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.update(ID, ClusterEndpointChanges.none());
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.AVAILABLE);
        assertThat(outcome.operation()).isEqualTo(LifecycleOperation.READ);
        assertThat(api.modifyCalls()).isZero();
    }
    
    @Test
    void updateWaitsUntilAvailableAgain() {
        api.existing("prod", "readers", "available").script("readers", "modifying", "available");
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.update(ID,
            new ClusterEndpointChanges(EndpointType.ANY, null, List.of("prod-3")));
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.AVAILABLE);
        assertThat(outcome.operation()).isEqualTo(LifecycleOperation.UPDATE);
        assertThat(outcome.polls()).isEqualTo(2);
        assertThat(outcome.snapshot().endpointType()).isEqualTo(EndpointType.ANY);
        assertThat(outcome.snapshot().excludedMembers()).containsExactly("prod-3");
        assertThat(api.modifyCalls()).isEqualTo(1);
    }
    
    // ==================== Delete ====================
    
    @Test
    void deleteWaitsUntilGone() {
        api.existing("prod", "readers", "available").script("readers", "deleting", GONE);
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.delete(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.ABSENT);
        assertThat(outcome.polls()).isEqualTo(2);
        assertThat(api.contains("readers")).isFalse();
    }
    
    @Test
    void deleteOfAlreadyDeletedEndpointSucceedsWithoutPolling() {
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.delete(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.ABSENT);
        assertThat(outcome.polls()).isZero();
        assertThat(api.deleteCalls()).isEqualTo(1);
        assertThat(api.describeCalls()).isZero();
    }
    
    @Test
    void deleteOfEndpointInMissingClusterSucceeds() {
        api.failDeleteWith(RemoteOperationException.fromResponse(
            "delete", 404, "DBClusterNotFoundFault", "cluster prod not found"));
        
        assertThat(orchestrator.delete(ID).status()).isEqualTo(LifecycleOutcome.Status.ABSENT);
    }
    
    @Test
    void deleteSucceedsWhenTheWaitReportsTheClusterGone() {
        AbsenceRules rules = AbsenceRules.builder()
            .absentOn(RemoteOperation.DESCRIBE, ENDPOINT_NOT_FOUND)
            .absentOn(RemoteOperation.DELETE, ENDPOINT_NOT_FOUND, "DBClusterNotFoundFault")
            .build();
        api.existing("prod", "readers", "available").failDescribeWith(RemoteOperationException.fromResponse(
            "describe", 404, "DBClusterNotFoundFault", "cluster prod not found"));
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator(api, settings, rules).delete(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.ABSENT);
        assertThat(outcome.polls()).isEqualTo(1);
        assertThat(api.deleteCalls()).isEqualTo(1);
    }
    
    @Test
    void deleteFailsWhenTheWaitReportsAnUnlistedCode() {
        AbsenceRules rules = AbsenceRules.builder()
            .absentOn(RemoteOperation.DESCRIBE, ENDPOINT_NOT_FOUND)
            .absentOn(RemoteOperation.DELETE, ENDPOINT_NOT_FOUND)
            .build();
        api.existing("prod", "readers", "available").failDescribeWith(RemoteOperationException.fromResponse(
            "describe", 404, "DBClusterNotFoundFault", "cluster prod not found"));
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator(api, settings, rules).delete(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.FAILED);
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.REMOTE_OPERATION_FAILED);
        assertThat(outcome.polls()).isEqualTo(1);
    }
    
    @Test
    void deleteRejectedForOtherReasonsFails() {
        api.existing("prod", "readers", "modifying").failDeleteWith(RemoteOperationException.fromResponse(
            "delete", 400, "InvalidDBClusterEndpointStateFault", "endpoint is modifying"));
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.delete(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.FAILED);
        assertThat(outcome.failure().getOperation()).isEqualTo("delete");
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.REMOTE_OPERATION_FAILED);
    }
    
    @Test
    void deleteTimeoutReportsDeletingState() {
        settings.setDeletedTimeout(Duration.ofMillis(50));
        settings.setPollInterval(Duration.ofMillis(5));
        api.existing("prod", "readers", "available");
        
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator(settings).delete(ID);
        
        assertThat(outcome.status()).isEqualTo(LifecycleOutcome.Status.FAILED);
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.CONVERGENCE_TIMEOUT);
        assertThat(outcome.failure().getCause())
            .isInstanceOfSatisfying(ConvergenceTimeoutException.class, 
                e -> assertThat(e.getLastLabel()).isEqualTo("deleting"));
        assertThat(outcome.polls()).isPositive().isEqualTo(api.describeCalls());
    }
    
    @Test
    void deleteWithMalformedIdentifierNeverCallsRemote() {
        LifecycleOutcome<ClusterEndpoint> outcome = orchestrator.delete("prod:readers:extra");
        
        assertThat(outcome.failure().getErrorCode()).isEqualTo(ErrorCode.MALFORMED_IDENTIFIER);
        assertThat(api.deleteCalls()).isZero();
    }
    
    // ==================== Metrics ====================
    
    @Test
    void recordsOutcomeMetrics() {
        api.script("readers", "creating", "available");
        orchestrator.create(SPEC);
        orchestrator.read("prod:missing");
        
        assertThat(meterRegistry.get("provisioner.lifecycle.operations")
            .tags("operation", "create", "status", "available").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("provisioner.lifecycle.operations")
            .tags("operation", "read", "status", "absent").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("provisioner.convergence.refreshes")
            .tags("operation", "create").summary().totalAmount()).isEqualTo(2.0);
    }
}
