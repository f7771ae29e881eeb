package com.platform.provisioner.config;

import com.platform.provisioner.error.RemoteOperationException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure beans: clock, HTTP transport with retry, and the lifecycle worker pool.
 */
@Slf4j
@Configuration
public class ProvisionerConfig {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public HttpClient controlPlaneHttpClient(ProvisionerProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getRemote().getConnectionTimeoutMs()))
            .build();
    }
    
    /**
     * Retries transient control plane failures (I/O errors, 429, 5xx).
     * Anything that gets past it is treated as fatal by the convergence engine.
     */
    @Bean
    public Retry controlPlaneRetry(ProvisionerProperties properties) {
        ProvisionerProperties.Remote remote = properties.getRemote();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(remote.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                remote.getRetryInitialWaitMs(), remote.getRetryMultiplier()))
            .retryOnException(e -> e instanceof RemoteOperationException remoteFailure
                && remoteFailure.isTransientFailure())
            .build();
        
        Retry retry = Retry.of("control-plane", config);
        retry.getEventPublisher()
            .onRetry(event -> log.warn("Retrying control plane call (attempt {}): {}", 
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }
    
    @Bean
    public ThreadPoolTaskExecutor provisioningTaskExecutor(ProvisionerProperties properties) {
        ProvisionerProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("provision-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
