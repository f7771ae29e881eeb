package com.platform.provisioner.resource.endpoint;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Desired state for a new cluster endpoint.
 * Identifiers follow the control plane naming rules: lowercase letters, digits and single
 * hyphens, starting with a letter, at most 63 characters.
 */
public record ClusterEndpointSpec(
    @NotBlank
    @Size(max = 63)
    @Pattern(regexp = IDENTIFIER_PATTERN, message = IDENTIFIER_MESSAGE)
    String clusterIdentifier,
    
    @NotBlank
    @Size(max = 63)
    @Pattern(regexp = IDENTIFIER_PATTERN, message = IDENTIFIER_MESSAGE)
    String endpointIdentifier,
    
    @NotNull
    EndpointType endpointType,
    
    List<String> staticMembers,
    
    List<String> excludedMembers
) {
    
    static final String IDENTIFIER_PATTERN = "^[a-z](?:-?[a-z0-9])*$";
    static final String IDENTIFIER_MESSAGE = 
        "must start with a letter and contain only lowercase letters, digits and single hyphens";
    
    public ClusterEndpointSpec {
        staticMembers = staticMembers != null ? List.copyOf(staticMembers) : List.of();
        excludedMembers = excludedMembers != null ? List.copyOf(excludedMembers) : List.of();
    }
}
