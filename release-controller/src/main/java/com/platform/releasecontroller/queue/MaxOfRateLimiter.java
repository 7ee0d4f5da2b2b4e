package com.platform.releasecontroller.queue;

import java.time.Duration;
import java.util.List;

/**
 * Uses the longest delay of all delegates.
 */
public class MaxOfRateLimiter<T> implements ItemRateLimiter<T> {
    
    private final List<ItemRateLimiter<T>> limiters;
    
    public MaxOfRateLimiter(List<ItemRateLimiter<T>> limiters) {
        this.limiters = List.copyOf(limiters);
    }
    
    @Override
    public Duration when(T item) {
        Duration longest = Duration.ZERO;
        for (ItemRateLimiter<T> limiter : limiters) {
            Duration delay = limiter.when(item);
            if (delay.compareTo(longest) > 0) {
                longest = delay;
            }
        }
        return longest;
    }
    
    @Override
    public void forget(T item) {
        limiters.forEach(limiter -> limiter.forget(item));
    }
    
    @Override
    public int numRequeues(T item) {
        return limiters.stream()
            .mapToInt(limiter -> limiter.numRequeues(item))
            .max()
            .orElse(0);
    }
}
