package com.platform.provisioner.config;

import com.platform.provisioner.error.RemoteOperationException;
import com.platform.provisioner.lookup.AbsenceRules;
import com.platform.provisioner.lookup.RemoteOperation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProvisionerPropertiesTest {
    
    @Test
    void convergenceDefaultsMatchRemoteBehaviour() {
        ProvisionerProperties.Convergence convergence = new ProvisionerProperties().getConvergence();
        
        assertThat(convergence.getAvailableTimeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(convergence.getDeletedTimeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(convergence.getPollInterval()).isNull();
        assertThat(convergence.getNotFoundChecks()).isEqualTo(20);
        assertThat(convergence.getContinuousTargetOccurrence()).isEqualTo(1);
    }
    
    @Test
    void unknownKindHasNoAbsenceCodes() {
        AbsenceRules rules = new ProvisionerProperties().resource("queue").toAbsenceRules();
        
        assertThat(rules.codesFor(RemoteOperation.DESCRIBE)).isEmpty();
        assertThat(rules.codesFor(RemoteOperation.DELETE)).isEmpty();
    }
    
    @Test
    void absenceCodesAreKeptPerOperation() {
        ProvisionerProperties.ResourceSettings settings = new ProvisionerProperties.ResourceSettings();
        settings.getAbsentErrorCodes().setDescribe(List.of("DBClusterEndpointNotFoundFault", "DBClusterNotFoundFault"));
        settings.getAbsentErrorCodes().setDelete(List.of("DBClusterEndpointNotFoundFault"));
        
        AbsenceRules rules = settings.toAbsenceRules();
        RemoteOperationException clusterGone = RemoteOperationException.fromResponse(
            "delete", 404, "DBClusterNotFoundFault", "cluster gone");
        
        assertThat(rules.isAbsent(RemoteOperation.DESCRIBE, clusterGone)).isTrue();
        assertThat(rules.isAbsent(RemoteOperation.DELETE, clusterGone)).isFalse();
        assertThat(rules.codesFor(RemoteOperation.MODIFY)).isEmpty();
        assertThat(rules.codesFor(RemoteOperation.CREATE)).isEmpty();
    }
}
