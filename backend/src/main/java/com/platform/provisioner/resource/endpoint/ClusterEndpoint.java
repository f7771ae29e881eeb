package com.platform.provisioner.resource.endpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Snapshot of a custom cluster endpoint as reported by the control plane.
 *
 * @param clusterIdentifier  owning cluster
 * @param endpointIdentifier endpoint name, unique within the cluster
 * @param endpointType       routing target
 * @param endpoint           DNS address, assigned by the control plane
 * @param status             lifecycle status, e.g. {@code creating}, {@code available}, {@code deleting}
 * @param staticMembers      instances always included
 * @param excludedMembers    instances never included
 * @param arn                resource name, assigned by the control plane
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterEndpoint(
    String clusterIdentifier,
    String endpointIdentifier,
    EndpointType endpointType,
    String endpoint,
    String status,
    List<String> staticMembers,
    List<String> excludedMembers,
    String arn
) {
    
    public ClusterEndpoint {
        staticMembers = staticMembers != null ? List.copyOf(staticMembers) : List.of();
        excludedMembers = excludedMembers != null ? List.copyOf(excludedMembers) : List.of();
    }
}
