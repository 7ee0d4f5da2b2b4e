package com.platform.releasecontroller.queue;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;

/**
 * Overall retry budget shared by all keys: {@code limit} retries per refresh period.
 * Keys are not tracked individually.
 */
public class TokenBucketRateLimiter<T> implements ItemRateLimiter<T> {
    
    private final RateLimiter rateLimiter;
    private final Duration maxDelay;
    
    public TokenBucketRateLimiter(int limit, Duration refreshPeriod, Duration maxDelay) {
        this.maxDelay = maxDelay;
        this.rateLimiter = RateLimiter.of("release-retry-bucket", RateLimiterConfig.custom()
            .limitForPeriod(limit)
            .limitRefreshPeriod(refreshPeriod)
            .timeoutDuration(maxDelay)
            .build());
    }
    
    @Override
    public Duration when(T item) {
        long waitNanos = rateLimiter.reservePermission();
        if (waitNanos < 0) {
            // Budget exhausted beyond the max delay
            return maxDelay;
        }
        return Duration.ofNanos(waitNanos);
    }
    
    @Override
    public void forget(T item) {
    }
    
    @Override
    public int numRequeues(T item) {
        return 0;
    }
}
