package com.platform.provisioner.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for provisioner metrics.
 * Records lifecycle operations, convergence waits and remote call latencies.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, DistributionSummary> summaries;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.summaries = new ConcurrentHashMap<>();
    }
    
    /**
     * Record the end of a lifecycle operation.
     */
    public void recordLifecycleOperation(String kind, String operation, String status, Duration elapsed) {
        incrementCounter("provisioner.lifecycle.operations", 
            "kind", kind, "operation", operation, "status", status);
        
        String timerKey = kind + "." + operation;
        timers.computeIfAbsent(timerKey, k ->
            Timer.builder("provisioner.lifecycle.duration")
                .tag("kind", kind)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry))
            .record(elapsed);
        
        log.debug("Recorded {} {} -> {} in {}ms", operation, kind, status, elapsed.toMillis());
    }
    
    /**
     * Record how a convergence wait ended and how many refreshes it took.
     */
    public void recordConvergence(String kind, String operation, String result, int refreshCount) {
        incrementCounter("provisioner.convergence.results", 
            "kind", kind, "operation", operation, "result", result);
        
        summaries.computeIfAbsent(kind + "." + operation, k ->
            DistributionSummary.builder("provisioner.convergence.refreshes")
                .tag("kind", kind)
                .tag("operation", operation)
                .register(meterRegistry))
            .record(refreshCount);
    }
    
    /**
     * Record latency of a call to the remote control plane.
     */
    public void recordRemoteCall(String kind, String operation, int statusCode, long latencyMs) {
        String timerKey = "remote." + kind + "." + operation;
        timers.computeIfAbsent(timerKey, k ->
            Timer.builder("provisioner.remote.latency")
                .tag("kind", kind)
                .tag("operation", operation)
                .register(meterRegistry))
            .record(Duration.ofMillis(latencyMs));
        
        incrementCounter("provisioner.remote.calls", 
            "kind", kind, "operation", operation, "status", String.valueOf(statusCode));
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
