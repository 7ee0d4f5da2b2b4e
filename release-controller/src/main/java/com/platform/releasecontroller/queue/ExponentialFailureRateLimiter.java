package com.platform.releasecontroller.queue;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Doubles the delay of a key on every failure, starting at the base delay and
 * capped at the max delay.
 */
public class ExponentialFailureRateLimiter<T> implements ItemRateLimiter<T> {
    
    private final IntervalFunction backoff;
    private final Map<T, Integer> failures = new ConcurrentHashMap<>();
    
    public ExponentialFailureRateLimiter(Duration baseDelay, Duration maxDelay) {
        this.backoff = IntervalFunction.ofExponentialBackoff(baseDelay.toMillis(), 2.0, maxDelay.toMillis());
    }
    
    @Override
    public Duration when(T item) {
        int attempt = failures.merge(item, 1, Integer::sum);
        return Duration.ofMillis(backoff.apply(attempt));
    }
    
    @Override
    public void forget(T item) {
        failures.remove(item);
    }
    
    @Override
    public int numRequeues(T item) {
        return failures.getOrDefault(item, 0);
    }
}
