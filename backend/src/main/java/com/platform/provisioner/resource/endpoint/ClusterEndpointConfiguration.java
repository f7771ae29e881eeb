package com.platform.provisioner.resource.endpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.provisioner.config.ProvisionerProperties;
import com.platform.provisioner.convergence.ConvergenceEngine;
import com.platform.provisioner.lifecycle.LifecycleOrchestrator;
import com.platform.provisioner.lookup.AbsenceRules;
import com.platform.provisioner.observability.MetricsRegistry;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Wiring for the cluster endpoint resource kind.
 */
@Slf4j
@Configuration
public class ClusterEndpointConfiguration {
    
    @Bean
    public ClusterEndpointApi clusterEndpointApi(
            @Qualifier("controlPlaneHttpClient") HttpClient httpClient,
            ObjectMapper objectMapper,
            @Qualifier("controlPlaneRetry") Retry retry,
            MetricsRegistry metricsRegistry,
            ProvisionerProperties properties) {
        log.info("Cluster endpoint control plane at {}", properties.getRemote().getBaseUrl());
        return new HttpClusterEndpointApi(httpClient, objectMapper, retry, metricsRegistry, properties.getRemote());
    }
    
    @Bean
    public ClusterEndpointResource clusterEndpointResource(ClusterEndpointApi api, ProvisionerProperties properties) {
        AbsenceRules rules = properties.resource(ClusterEndpointResource.KIND).toAbsenceRules();
        log.info("Absence rules for {}: {}", ClusterEndpointResource.KIND, rules);
        return new ClusterEndpointResource(api, rules);
    }
    
    @Bean
    public LifecycleOrchestrator<ClusterEndpoint, ClusterEndpointSpec, ClusterEndpointChanges> clusterEndpointOrchestrator(
            ClusterEndpointResource resource,
            ConvergenceEngine engine,
            ProvisionerProperties properties,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        return new LifecycleOrchestrator<>(resource, engine, properties.getConvergence(), metricsRegistry, clock);
    }
}
