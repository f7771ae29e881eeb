package com.platform.provisioner.config;

import com.platform.provisioner.lookup.AbsenceRules;
import com.platform.provisioner.lookup.RemoteOperation;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the provisioner.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "provisioner")
public class ProvisionerProperties {
    
    /**
     * Defaults applied to every convergence wait.
     */
    private Convergence convergence = new Convergence();
    
    /**
     * Remote control plane connection.
     */
    private Remote remote = new Remote();
    
    /**
     * Worker pool for asynchronous lifecycle operations.
     */
    private Executor executor = new Executor();
    
    /**
     * Per resource kind settings, keyed by kind name (e.g. cluster-endpoint).
     */
    private Map<String, ResourceSettings> resources = new HashMap<>();
    
    /**
     * Settings for a kind, falling back to an empty entry when none is configured.
     */
    public ResourceSettings resource(String kind) {
        return resources.getOrDefault(kind, new ResourceSettings());
    }
    
    @Data
    public static class Convergence {
        /**
         * Maximum time to wait for a resource to become available after create or update.
         */
        private Duration availableTimeout = Duration.ofMinutes(10);
        
        /**
         * Maximum time to wait for a resource to disappear after delete.
         */
        private Duration deletedTimeout = Duration.ofMinutes(10);
        
        /**
         * Wait before the first refresh.
         */
        private Duration delay = Duration.ZERO;
        
        /**
         * Fixed poll interval. Unset selects exponential backoff.
         */
        private Duration pollInterval;
        
        private Duration minBackoff = Duration.ofMillis(100);
        
        private Duration maxBackoff = Duration.ofSeconds(10);
        
        /**
         * Consecutive absent observations tolerated while waiting for a resource to appear.
         */
        private int notFoundChecks = 20;
        
        /**
         * Consecutive target observations required before a wait succeeds.
         */
        private int continuousTargetOccurrence = 1;
    }
    
    @Data
    public static class Remote {
        /**
         * Base URL of the control plane API.
         */
        private String baseUrl = "http://localhost:8090/v1";
        
        private int connectionTimeoutMs = 5000;
        
        private int readTimeoutMs = 10000;
        
        /**
         * Attempts per remote call, including the first, for transient failures.
         */
        private int maxAttempts = 3;
        
        private long retryInitialWaitMs = 500;
        
        private double retryMultiplier = 2.0;
    }
    
    @Data
    public static class Executor {
        private int corePoolSize = 4;
        
        private int maxPoolSize = 16;
        
        private int queueCapacity = 100;
    }
    
    @Data
    public static class ResourceSettings {
        /**
         * Remote error codes meaning "already gone", per remote operation.
         */
        private AbsentErrorCodes absentErrorCodes = new AbsentErrorCodes();
        
        public AbsenceRules toAbsenceRules() {
            return AbsenceRules.builder()
                .absentOn(RemoteOperation.DESCRIBE, absentErrorCodes.getDescribe())
                .absentOn(RemoteOperation.DELETE, absentErrorCodes.getDelete())
                .build();
        }
    }
    
    @Data
    public static class AbsentErrorCodes {
        private List<String> describe = new ArrayList<>();
        
        private List<String> delete = new ArrayList<>();
    }
}
