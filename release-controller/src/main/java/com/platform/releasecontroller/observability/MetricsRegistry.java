package com.platform.releasecontroller.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Central registry for controller metrics: queue depth, enqueues, reconcile outcomes and sweeps.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }
    
    /**
     * Expose the pending length of a work queue.
     */
    public void registerQueueDepth(String queue, Supplier<Number> depth) {
        Gauge.builder("controller.queue.depth", depth)
            .tag("queue", queue)
            .description("Keys waiting to be reconciled")
            .register(meterRegistry);
        log.debug("Registered depth gauge for queue {}", queue);
    }
    
    /**
     * Record a key handed to the queue by a watch event.
     */
    public void recordEnqueue(String event) {
        incrementCounter("controller.enqueue", "event", event);
    }
    
    /**
     * Record a notification or key that was dropped without reconciliation.
     */
    public void recordDropped(String reason) {
        incrementCounter("controller.enqueue.dropped", "reason", reason);
    }
    
    /**
     * Record the outcome of one reconcile attempt.
     */
    public void recordReconcile(String action, String outcome, long latencyMs) {
        incrementCounter("controller.reconcile", "action", action, "outcome", outcome);
        
        String timerKey = action + "." + outcome;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("controller.reconcile.latency")
                .tag("action", action)
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Record a consistency sweep.
     */
    public void recordSweep(String outcome, int repaired) {
        incrementCounter("controller.sweep", "outcome", outcome);
        if (repaired > 0) {
            counters.computeIfAbsent("controller.sweep.repaired", k ->
                Counter.builder("controller.sweep.repaired")
                    .register(meterRegistry))
                .increment(repaired);
        }
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
    
    /**
     * Current value of a counter, 0 if it was never incremented.
     */
    public double getCount(String name, String... tags) {
        Counter counter = counters.get(name + String.join(".", tags));
        return counter != null ? counter.count() : 0;
    }
}
