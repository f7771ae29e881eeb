package com.platform.provisioner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Resource Provisioner Application
 * 
 * Drives remote cloud resources through their lifecycle:
 * - create, update and delete with convergence waits
 * - read and import by persisted identifier
 * - cancellation of in-flight operations
 */
@SpringBootApplication
public class ProvisionerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProvisionerApplication.class, args);
    }
}
