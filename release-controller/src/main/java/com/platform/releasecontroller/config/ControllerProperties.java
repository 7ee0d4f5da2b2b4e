package com.platform.releasecontroller.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the release controller.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "controller")
public class ControllerProperties {
    
    /**
     * Whether the controller starts once the application is ready.
     */
    private boolean enabled = true;
    
    /**
     * Number of reconcile workers.
     */
    private int workers = 2;
    
    /**
     * Pause between two drains of the queue by one worker.
     */
    private Duration workerPeriod = Duration.ofSeconds(1);
    
    /**
     * How often the cache is polled while waiting for the initial sync.
     */
    private Duration cacheSyncPollInterval = Duration.ofMillis(100);
    
    /**
     * How long workers get to finish in-flight items on stop.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    
    /**
     * Run the consistency sweep before every drain, not only at startup.
     */
    private boolean periodicSweep = false;
    
    private Backoff backoff = new Backoff();
    
    private Bucket bucket = new Bucket();
    
    /**
     * Per-key exponential retry delay.
     */
    @Data
    public static class Backoff {
        private Duration baseDelay = Duration.ofMillis(5);
        private Duration maxDelay = Duration.ofSeconds(1000);
    }
    
    /**
     * Overall retry token bucket: {@code limit} permits every {@code refreshPeriod}.
     */
    @Data
    public static class Bucket {
        private int limit = 100;
        private Duration refreshPeriod = Duration.ofSeconds(10);
    }
}
