package com.platform.releasecontroller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Release Controller Application
 * 
 * Watches declared releases and drives each one toward its desired state:
 * - Create, update and roll back deployed resources
 * - Remove resources and histories of deleted releases
 * - Repair leftovers of an unclean shutdown at startup
 * 
 * Features:
 * - Deduplicating, rate-limited retry queue
 * - Release conditions recorded on every attempt
 * - Metrics, structured logs and traces per reconcile
 */
@SpringBootApplication
public class ReleaseControllerApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ReleaseControllerApplication.class, args);
    }
}
