package com.platform.provisioner.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for requests and MDC helpers for lifecycle operations.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_OPERATION = "operation";
    public static final String MDC_RESOURCE_KIND = "resourceKind";
    public static final String MDC_RESOURCE_ID = "resourceId";
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Set lifecycle operation context for detailed logging.
     */
    public static void setOperationContext(String operation, String resourceKind, String resourceId) {
        MDC.put(MDC_OPERATION, operation);
        MDC.put(MDC_RESOURCE_KIND, resourceKind);
        setResourceId(resourceId);
    }
    
    /**
     * Update the resource id once it is known (after a create).
     */
    public static void setResourceId(String resourceId) {
        if (resourceId != null) {
            MDC.put(MDC_RESOURCE_ID, resourceId);
        }
    }
    
    /**
     * Clear operation context.
     */
    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_RESOURCE_KIND);
        MDC.remove(MDC_RESOURCE_ID);
    }
}
