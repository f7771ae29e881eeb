package com.platform.provisioner.resource.endpoint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.provisioner.lifecycle.ChangeSet;

import java.util.List;

/**
 * Mutable attributes of a cluster endpoint. Null means "unchanged"; an empty list clears the members.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClusterEndpointChanges(
    EndpointType endpointType,
    List<String> staticMembers,
    List<String> excludedMembers
) implements ChangeSet {
    
    public static ClusterEndpointChanges none() {
        return new ClusterEndpointChanges(null, null, null);
    }
    
    @Override
    public boolean hasChanges() {
        return endpointType != null || staticMembers != null || excludedMembers != null;
    }
}
