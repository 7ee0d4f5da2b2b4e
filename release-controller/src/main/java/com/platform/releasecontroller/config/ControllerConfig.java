package com.platform.releasecontroller.config;

import com.platform.releasecontroller.cache.ReleaseCache;
import com.platform.releasecontroller.controller.ReleaseController;
import com.platform.releasecontroller.controller.ReleaseEventAdapter;
import com.platform.releasecontroller.manager.ReleaseManager;
import com.platform.releasecontroller.observability.MetricsRegistry;
import com.platform.releasecontroller.queue.ItemRateLimiter;
import com.platform.releasecontroller.queue.RateLimitingRetryQueue;
import com.platform.releasecontroller.queue.RetryQueue;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring of the reconcile pipeline: queue, notification adapter and controller.
 */
@Slf4j
@Configuration
public class ControllerConfig {
    
    private static final String QUEUE_NAME = "releases";
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean(destroyMethod = "shutDown")
    public RetryQueue<String> releaseQueue(ControllerProperties properties, MetricsRegistry metricsRegistry) {
        ControllerProperties.Backoff backoff = properties.getBackoff();
        ControllerProperties.Bucket bucket = properties.getBucket();
        
        RetryQueue<String> queue = new RateLimitingRetryQueue<>(QUEUE_NAME, ItemRateLimiter.controllerDefault(
            backoff.getBaseDelay(),
            backoff.getMaxDelay(),
            bucket.getLimit(),
            bucket.getRefreshPeriod()
        ));
        metricsRegistry.registerQueueDepth(QUEUE_NAME, queue::length);
        
        log.info("Release queue created (backoff {} to {}, bucket {} per {})",
            backoff.getBaseDelay(), backoff.getMaxDelay(), bucket.getLimit(), bucket.getRefreshPeriod());
        return queue;
    }
    
    @Bean
    public ReleaseEventAdapter releaseEventAdapter(RetryQueue<String> releaseQueue, MetricsRegistry metricsRegistry) {
        return new ReleaseEventAdapter(releaseQueue, metricsRegistry);
    }
    
    @Bean
    public ReleaseController releaseController(
            ReleaseCache cache,
            ReleaseManager manager,
            RetryQueue<String> releaseQueue,
            ReleaseEventAdapter releaseEventAdapter,
            ControllerProperties properties,
            MetricsRegistry metricsRegistry,
            Tracer tracer,
            Clock clock) {
        return new ReleaseController(cache, manager, releaseQueue, releaseEventAdapter,
            properties, metricsRegistry, tracer, clock);
    }
}
