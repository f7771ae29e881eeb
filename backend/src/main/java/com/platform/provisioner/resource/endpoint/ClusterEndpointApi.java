package com.platform.provisioner.resource.endpoint;

import java.util.List;

/**
 * Remote control plane operations for cluster endpoints.
 * Failures surface as {@link com.platform.provisioner.error.RemoteOperationException}.
 */
public interface ClusterEndpointApi {
    
    ClusterEndpoint createEndpoint(ClusterEndpointSpec spec);
    
    ClusterEndpoint modifyEndpoint(String endpointIdentifier, ClusterEndpointChanges changes);
    
    void deleteEndpoint(String endpointIdentifier);
    
    /**
     * Lists endpoints matching both identifiers; empty when nothing matches.
     */
    List<ClusterEndpoint> describeEndpoints(String clusterIdentifier, String endpointIdentifier);
}
