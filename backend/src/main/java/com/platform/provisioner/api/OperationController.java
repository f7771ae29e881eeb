package com.platform.provisioner.api;

import com.platform.provisioner.error.ResourceNotFoundException;
import com.platform.provisioner.lifecycle.ProvisioningExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

/**
 * In-flight lifecycle operations.
 */
@RestController
@RequestMapping("/api/operations")
@RequiredArgsConstructor
public class OperationController {
    
    private final ProvisioningExecutor executor;
    
    @GetMapping
    public Map<String, Set<String>> inFlight() {
        return Map.of("inFlight", executor.inFlight());
    }
    
    /**
     * Cancel a running operation. The blocked request then fails with PV-503.
     */
    @DeleteMapping("/{operationId}")
    public ResponseEntity<Void> cancel(@PathVariable String operationId) {
        if (!executor.cancel(operationId)) {
            throw new ResourceNotFoundException("operation", operationId);
        }
        return ResponseEntity.accepted().build();
    }
}
