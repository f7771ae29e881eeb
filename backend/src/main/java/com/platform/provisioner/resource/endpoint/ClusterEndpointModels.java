package com.platform.provisioner.resource.endpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTOs for the cluster endpoint control plane API.
 */
public class ClusterEndpointModels {
    
    /**
     * Body of {@code POST /cluster-endpoints}.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class CreateEndpointRequest {
        private String clusterIdentifier;
        private String endpointIdentifier;
        private EndpointType endpointType;
        private List<String> staticMembers;
        private List<String> excludedMembers;
        
        public static CreateEndpointRequest from(ClusterEndpointSpec spec) {
            return new CreateEndpointRequest(
                spec.clusterIdentifier(),
                spec.endpointIdentifier(),
                spec.endpointType(),
                spec.staticMembers(),
                spec.excludedMembers());
        }
    }
    
    /**
     * Single endpoint wrapper returned by create and modify.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EndpointResponse {
        private ClusterEndpoint endpoint;
    }
    
    /**
     * Result of a describe call. An empty list means no match.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EndpointListResponse {
        private List<ClusterEndpoint> endpoints = new ArrayList<>();
    }
    
    /**
     * Error body: {@code {"error": {"code": "...", "message": "..."}}}.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorEnvelope {
        private RemoteError error;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RemoteError {
        private String code;
        private String message;
    }
}
