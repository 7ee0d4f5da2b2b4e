package com.platform.releasecontroller.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Deduplicating, rate-limited work queue of reconcile keys.
 * 
 * A key is in at most one of three places: waiting for a delay, pending, or processing.
 * Adding a pending key is a no-op; adding a processing key marks it dirty so that it
 * becomes pending again on {@link #done}. This gives at most one concurrent
 * reconciliation per key regardless of how many events arrive.
 * 
 * All methods are safe for concurrent use.
 */
public interface RetryQueue<T> {
    
    /**
     * Mark the key as needing processing.
     */
    void add(T item);
    
    /**
     * Block until a key is available and move it to processing.
     * 
     * @return the key, or empty once the queue is shutting down
     */
    Optional<T> get();
    
    /**
     * Mark the key as no longer processing.
     */
    void done(T item);
    
    /**
     * Add the key once the delay has passed. Waiting copies of the same key are
     * coalesced to the earliest deadline.
     */
    void addAfter(T item, Duration delay);
    
    /**
     * Add the key after the delay chosen by the rate limiter.
     */
    void addRateLimited(T item);
    
    /**
     * Stop tracking failures for the key.
     */
    void forget(T item);
    
    int numRequeues(T item);
    
    /**
     * Number of pending keys.
     */
    int length();
    
    /**
     * Unblock every {@link #get} permanently. Later adds are ignored.
     */
    void shutDown();
    
    boolean isShuttingDown();
}
