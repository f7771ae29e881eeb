package com.platform.provisioner.resource.endpoint;

import com.platform.provisioner.error.RemoteOperationException;
import com.platform.provisioner.identifier.ResourceIdentifierCodec;
import com.platform.provisioner.lifecycle.ManagedResource;
import com.platform.provisioner.lookup.AbsenceRules;
import com.platform.provisioner.lookup.Lookup;
import com.platform.provisioner.lookup.RemoteOperation;
import com.platform.provisioner.lookup.StatusExtractor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Binds the {@code cluster-endpoint} kind to its control plane API.
 * <p>
 * Identifier layout is {@code CLUSTER-ID:CLUSTER-ENDPOINT-ID}. Modify and delete address the
 * endpoint by its endpoint identifier alone; describe filters on both parts.
 */
@Slf4j
public class ClusterEndpointResource 
        implements ManagedResource<ClusterEndpoint, ClusterEndpointSpec, ClusterEndpointChanges> {
    
    public static final String KIND = "cluster-endpoint";
    
    static final ResourceIdentifierCodec CODEC = ResourceIdentifierCodec.of("CLUSTER-ID", "CLUSTER-ENDPOINT-ID");
    
    private static final StatusExtractor<ClusterEndpoint> STATUS = StatusExtractor.of(ClusterEndpoint::status);
    
    private final ClusterEndpointApi api;
    private final AbsenceRules absenceRules;
    
    public ClusterEndpointResource(ClusterEndpointApi api, AbsenceRules absenceRules) {
        this.api = api;
        this.absenceRules = absenceRules;
    }
    
    @Override
    public String kind() {
        return KIND;
    }
    
    @Override
    public ResourceIdentifierCodec identifierCodec() {
        return CODEC;
    }
    
    @Override
    public AbsenceRules absenceRules() {
        return absenceRules;
    }
    
    @Override
    public StatusExtractor<ClusterEndpoint> statusExtractor() {
        return STATUS;
    }
    
    /**
     * Absence is reported either as one of the configured describe error codes or as an empty result.
     */
    @Override
    public Lookup<ClusterEndpoint> find(String id) {
        List<String> parts = CODEC.decode(id);
        List<ClusterEndpoint> endpoints;
        try {
            endpoints = api.describeEndpoints(parts.get(0), parts.get(1));
        } catch (RemoteOperationException e) {
            if (absenceRules.isAbsent(RemoteOperation.DESCRIBE, e)) {
                log.debug("Describe of {} reported absence: {}", id, e.getRemoteErrorCode());
                return Lookup.notFound(e.getRemoteErrorCode());
            }
            throw e;
        }
        
        if (endpoints.isEmpty()) {
            return Lookup.notFound("Empty result");
        }
        return Lookup.found(endpoints.get(0));
    }
    
    @Override
    public List<String> create(ClusterEndpointSpec spec) {
        ClusterEndpoint created = api.createEndpoint(spec);
        if (created == null || created.clusterIdentifier() == null || created.endpointIdentifier() == null) {
            throw RemoteOperationException.invalidResponse(RemoteOperation.CREATE.wireName(),
                new IllegalStateException("created endpoint carries no identifier for " + spec.endpointIdentifier()));
        }
        return List.of(created.clusterIdentifier(), created.endpointIdentifier());
    }
    
    @Override
    public void modify(List<String> idParts, ClusterEndpointChanges changes) {
        api.modifyEndpoint(idParts.get(1), changes);
    }
    
    @Override
    public void delete(List<String> idParts) {
        api.deleteEndpoint(idParts.get(1));
    }
}
