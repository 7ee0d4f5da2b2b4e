package com.platform.releasecontroller.queue;

import java.time.Duration;
import java.util.List;

/**
 * Decides how long a failed key waits before it is retried.
 */
public interface ItemRateLimiter<T> {
    
    /**
     * Delay before the next retry of the key. Each call counts as one failure.
     */
    Duration when(T item);
    
    /**
     * Reset failure tracking for the key.
     */
    void forget(T item);
    
    int numRequeues(T item);
    
    /**
     * Per-key exponential backoff combined with an overall token bucket.
     */
    static <T> ItemRateLimiter<T> controllerDefault(
            Duration baseDelay, Duration maxDelay, int bucketLimit, Duration bucketRefreshPeriod) {
        return new MaxOfRateLimiter<>(List.of(
            new ExponentialFailureRateLimiter<>(baseDelay, maxDelay),
            new TokenBucketRateLimiter<>(bucketLimit, bucketRefreshPeriod, maxDelay)
        ));
    }
}
