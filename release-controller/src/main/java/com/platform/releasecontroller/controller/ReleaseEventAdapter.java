package com.platform.releasecontroller.controller;

import com.platform.releasecontroller.cache.ReleaseEventHandler;
import com.platform.releasecontroller.cache.ReleaseKey;
import com.platform.releasecontroller.error.KeyDecodeException;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.observability.MetricsRegistry;
import com.platform.releasecontroller.queue.RetryQueue;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns release watch notifications into reconcile keys.
 *
 * The event kind is not carried into the queue: the loop always re-reads the cache,
 * so an add, an update and a delete of the same release all collapse into one key.
 * Updates that only wrote the status (same generation, new resourceVersion) come from
 * the manager itself and are skipped; failed keys come back through the rate limiter.
 */
@Slf4j
public class ReleaseEventAdapter implements ReleaseEventHandler {
    
    private final RetryQueue<String> queue;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    
    public ReleaseEventAdapter(RetryQueue<String> queue, MetricsRegistry metricsRegistry) {
        this.queue = queue;
        this.metricsRegistry = metricsRegistry;
    }
    
    @Override
    public void onAdd(Release release) {
        enqueue("add", release);
    }
    
    @Override
    public void onUpdate(Release oldRelease, Release newRelease) {
        if (isStatusWrite(oldRelease, newRelease)) {
            log.trace("Skipping status update of {}/{}", newRelease.getNamespace(), newRelease.getName());
            metricsRegistry.recordDropped("status-update");
            return;
        }
        enqueue("update", newRelease);
    }
    
    @Override
    public void onDelete(Object obj) {
        enqueue("delete", obj);
    }
    
    /**
     * Ignore every later notification.
     */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.info("Release event adapter stopped");
        }
    }
    
    public boolean isStopped() {
        return stopped.get();
    }
    
    private static boolean isStatusWrite(Release oldRelease, Release newRelease) {
        return oldRelease != null
            && oldRelease.getGeneration() == newRelease.getGeneration()
            && oldRelease.getResourceVersion() != newRelease.getResourceVersion();
    }
    
    private void enqueue(String event, Object obj) {
        if (stopped.get()) {
            return;
        }
        String key;
        try {
            key = ReleaseKey.keyFor(obj);
        } catch (KeyDecodeException e) {
            log.warn("Dropping {} notification: {}", event, e.getMessage());
            metricsRegistry.recordDropped("invalid-key");
            return;
        }
        queue.add(key);
        metricsRegistry.recordEnqueue(event);
    }
}
