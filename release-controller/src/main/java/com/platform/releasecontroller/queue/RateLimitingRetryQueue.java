package com.platform.releasecontroller.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link RetryQueue} backed by a FIFO list plus dirty and processing sets.
 * Delayed adds run on a single daemon scheduler owned by the queue.
 */
@Slf4j
public class RateLimitingRetryQueue<T> implements RetryQueue<T> {
    
    private final String name;
    private final ItemRateLimiter<T> rateLimiter;
    private final ScheduledExecutorService delayScheduler;
    
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition itemAvailable = lock.newCondition();
    
    // Guarded by lock
    private final Deque<T> queue = new ArrayDeque<>();
    private final Set<T> dirty = new HashSet<>();
    private final Set<T> processing = new HashSet<>();
    private final Map<T, Waiting> waiting = new HashMap<>();
    private boolean shuttingDown;
    
    public RateLimitingRetryQueue(String name, ItemRateLimiter<T> rateLimiter) {
        this.name = name;
        this.rateLimiter = rateLimiter;
        this.delayScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, name + "-delay");
            thread.setDaemon(true);
            return thread;
        });
    }
    
    @Override
    public void add(T item) {
        lock.lock();
        try {
            addLocked(item);
        } finally {
            lock.unlock();
        }
    }
    
    private void addLocked(T item) {
        if (shuttingDown) {
            log.debug("Queue {} is shutting down, ignoring {}", name, item);
            return;
        }
        if (!dirty.add(item)) {
            return;
        }
        if (processing.contains(item)) {
            // Re-queued by done()
            return;
        }
        queue.addLast(item);
        itemAvailable.signal();
    }
    
    @Override
    public Optional<T> get() {
        lock.lock();
        try {
            while (queue.isEmpty() && !shuttingDown) {
                itemAvailable.await();
            }
            if (shuttingDown) {
                return Optional.empty();
            }
            T item = queue.pollFirst();
            processing.add(item);
            dirty.remove(item);
            return Optional.of(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting on queue {}", name);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void done(T item) {
        lock.lock();
        try {
            processing.remove(item);
            if (dirty.contains(item) && !shuttingDown) {
                queue.addLast(item);
                itemAvailable.signal();
            }
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void addAfter(T item, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            add(item);
            return;
        }
        
        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }
            long readyAt = System.nanoTime() + delay.toNanos();
            Waiting existing = waiting.get(item);
            if (existing != null) {
                if (existing.readyAtNanos() - readyAt <= 0) {
                    return;
                }
                existing.future().cancel(false);
            }
            ScheduledFuture<?> future = delayScheduler.schedule(
                () -> fireWaiting(item, readyAt), delay.toNanos(), TimeUnit.NANOSECONDS);
            waiting.put(item, new Waiting(future, readyAt));
        } finally {
            lock.unlock();
        }
    }
    
    private void fireWaiting(T item, long readyAt) {
        lock.lock();
        try {
            Waiting current = waiting.get(item);
            if (current == null || current.readyAtNanos() != readyAt) {
                return;
            }
            waiting.remove(item);
            addLocked(item);
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void addRateLimited(T item) {
        Duration delay = rateLimiter.when(item);
        log.debug("Requeue {} on {} in {} ms", item, name, delay.toMillis());
        addAfter(item, delay);
    }
    
    @Override
    public void forget(T item) {
        rateLimiter.forget(item);
    }
    
    @Override
    public int numRequeues(T item) {
        return rateLimiter.numRequeues(item);
    }
    
    @Override
    public int length() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void shutDown() {
        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            waiting.values().forEach(w -> w.future().cancel(false));
            waiting.clear();
            log.info("Queue {} shutting down ({} pending, {} processing)", 
                name, queue.size(), processing.size());
            itemAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        delayScheduler.shutdownNow();
    }
    
    @Override
    public boolean isShuttingDown() {
        lock.lock();
        try {
            return shuttingDown;
        } finally {
            lock.unlock();
        }
    }
    
    private record Waiting(ScheduledFuture<?> future, long readyAtNanos) {}
}
