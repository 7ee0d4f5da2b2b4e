package com.platform.releasecontroller.controller;

import com.platform.releasecontroller.cache.ReleaseCache;
import com.platform.releasecontroller.cache.ReleaseKey;
import com.platform.releasecontroller.config.ControllerProperties;
import com.platform.releasecontroller.error.ErrorCode;
import com.platform.releasecontroller.error.KeyDecodeException;
import com.platform.releasecontroller.manager.ReleaseManager;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.observability.LoggingConfig;
import com.platform.releasecontroller.observability.MetricsRegistry;
import com.platform.releasecontroller.queue.RetryQueue;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives releases toward their desired state.
 *
 * Watch notifications reach the queue through {@link ReleaseEventAdapter}; workers take
 * keys off the queue, re-read the release from the cache and hand it to the
 * {@link ReleaseManager}. A key is never reconciled by two workers at once.
 *
 * Lifecycle of {@link #run}:
 * 1. Wait for the cache to sync
 * 2. Run one consistency sweep
 * 3. Start workers
 * 4. On stop: stop notifications, shut the queue down, let in-flight items finish
 */
@Slf4j
public class ReleaseController {
    
    public enum Phase {
        CREATED,
        WAITING_FOR_SYNC,
        SWEEPING,
        RUNNING,
        DRAINING,
        STOPPED
    }
    
    private final ReleaseCache cache;
    private final ReleaseManager manager;
    private final RetryQueue<String> queue;
    private final ReleaseEventAdapter adapter;
    private final ControllerProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final Tracer tracer;
    private final Clock clock;
    
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.CREATED);
    private final AtomicLong reconciled = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicInteger liveWorkers = new AtomicInteger();
    private final ReentrantLock sweepLock = new ReentrantLock();
    
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile Instant startedAt;
    private volatile Instant lastSweep;
    
    public ReleaseController(
            ReleaseCache cache,
            ReleaseManager manager,
            RetryQueue<String> queue,
            ReleaseEventAdapter adapter,
            ControllerProperties properties,
            MetricsRegistry metricsRegistry,
            Tracer tracer,
            Clock clock) {
        this.cache = cache;
        this.manager = manager;
        this.queue = queue;
        this.adapter = adapter;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        this.tracer = tracer;
        this.clock = clock;
        
        cache.addEventHandler(adapter);
    }
    
    /**
     * Run the controller until the stop signal fires. Blocks the calling thread.
     */
    public void run(CountDownLatch stopSignal) {
        if (!phase.compareAndSet(Phase.CREATED, Phase.WAITING_FOR_SYNC)) {
            throw new IllegalStateException("Release controller already ran: " + phase.get());
        }
        this.stopSignal = stopSignal;
        startedAt = clock.instant();
        log.info("Starting release controller with {} workers", properties.getWorkers());
        
        if (!waitForCacheSync(stopSignal)) {
            log.error("[{}] {}: stopped before the release cache synced",
                ErrorCode.STARTUP_SYNC_FAILED.getCode(), ErrorCode.STARTUP_SYNC_FAILED.getDefaultMessage());
            shutDownIntake();
            phase.set(Phase.STOPPED);
            return;
        }
        log.info("Release cache synced");
        
        phase.set(Phase.SWEEPING);
        sweep("startup");
        
        ExecutorService workers = Executors.newFixedThreadPool(properties.getWorkers(), new WorkerThreadFactory());
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < properties.getWorkers(); i++) {
            liveWorkers.incrementAndGet();
            futures.add(workers.submit(this::worker));
        }
        phase.set(Phase.RUNNING);
        log.info("Release controller running");
        
        awaitUninterruptibly(stopSignal);
        
        log.info("Shutting down release controller");
        phase.set(Phase.DRAINING);
        shutDownIntake();
        drain(workers, futures);
        phase.set(Phase.STOPPED);
        log.info("Release controller stopped");
    }
    
    /**
     * Take one key off the queue and reconcile it.
     *
     * @return false if the queue is shutting down or the key failed and was requeued
     */
    boolean processNextWorkItem() {
        Optional<String> next = queue.get();
        if (next.isEmpty()) {
            return false;
        }
        String key = next.get();
        
        LoggingConfig.setReleaseContext(key);
        Span span = tracer.spanBuilder("release.reconcile")
            .setAttribute("release.key", key)
            .startSpan();
        long start = System.nanoTime();
        String action = "decode";
        
        try (Scope ignored = span.makeCurrent()) {
            ReleaseKey releaseKey;
            try {
                releaseKey = ReleaseKey.parse(key);
            } catch (KeyDecodeException e) {
                log.error("Can't recognize key of release '{}': {}", e.getKey(), e.getMessage());
                queue.forget(key);
                dropped.incrementAndGet();
                metricsRegistry.recordDropped("invalid-key");
                span.setStatus(StatusCode.ERROR, e.getMessage());
                record(action, "dropped", start);
                return true;
            }
            span.setAttribute("release.namespace", releaseKey.namespace());
            action = "lookup";
            
            try {
                Optional<Release> release = cache.lookup(releaseKey.namespace(), releaseKey.name());
                if (release.isEmpty()) {
                    action = "delete";
                    manager.delete(releaseKey.namespace(), releaseKey.name());
                } else {
                    action = "trigger";
                    manager.trigger(release.get());
                }
                queue.forget(key);
                reconciled.incrementAndGet();
                record(action, "success", start);
                log.debug("Handled release {}", key);
                return true;
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Exception | Error e) {
                queue.addRateLimited(key);
                failed.incrementAndGet();
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
                record(action, "retry", start);
                if (e instanceof Error) {
                    log.error("Unexpected error while trying to {} release {}, retry {}", action, key, queue.numRequeues(key), e);
                } else {
                    log.warn("Can't {} release {}, retry {}: {}", action, key, queue.numRequeues(key), e.getMessage());
                }
                return false;
            }
        } finally {
            queue.done(key);
            span.end();
            LoggingConfig.clearReleaseContext();
        }
    }
    
    public ControllerStatus getStatus() {
        return new ControllerStatus(
            phase.get(),
            cache.hasSynced(),
            liveWorkers.get(),
            queue.length(),
            reconciled.get(),
            failed.get(),
            dropped.get(),
            startedAt,
            lastSweep
        );
    }
    
    public Phase getPhase() {
        return phase.get();
    }
    
    // ==================== Workers ====================
    
    private void worker() {
        try {
            while (!queue.isShuttingDown()) {
                try {
                    if (properties.isPeriodicSweep()) {
                        sweep("periodic");
                    }
                    while (processNextWorkItem()) {
                        // drain
                    }
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (RuntimeException | Error e) {
                    log.error("Worker {} hit an unexpected failure, continuing", Thread.currentThread().getName(), e);
                }
                if (queue.isShuttingDown() || awaitStop(properties.getWorkerPeriod())) {
                    break;
                }
            }
            log.debug("Worker {} exiting", Thread.currentThread().getName());
        } finally {
            liveWorkers.decrementAndGet();
        }
    }
    
    /**
     * Run the consistency sweep. Concurrent callers skip instead of queueing up.
     */
    private void sweep(String trigger) {
        if (!sweepLock.tryLock()) {
            log.debug("Consistency sweep already running, skipping {} sweep", trigger);
            return;
        }
        try {
            int repaired = manager.run();
            lastSweep = clock.instant();
            metricsRegistry.recordSweep("success", repaired);
        } catch (RuntimeException e) {
            log.error("Can't run {} consistency sweep: {}", trigger, e.getMessage(), e);
            metricsRegistry.recordSweep("failure", 0);
        } finally {
            sweepLock.unlock();
        }
    }
    
    // ==================== Lifecycle ====================
    
    private boolean waitForCacheSync(CountDownLatch stopSignal) {
        Duration poll = properties.getCacheSyncPollInterval();
        while (!cache.hasSynced()) {
            try {
                if (stopSignal.await(poll.toMillis(), TimeUnit.MILLISECONDS)) {
                    return false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }
    
    private void shutDownIntake() {
        adapter.stop();
        cache.removeEventHandler(adapter);
        queue.shutDown();
    }
    
    private void drain(ExecutorService workers, List<Future<?>> futures) {
        workers.shutdown();
        Duration timeout = properties.getShutdownTimeout();
        try {
            if (workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("All workers finished");
            } else {
                log.warn("Workers still busy after {} ms, interrupting", timeout.toMillis());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            return;
        }
        reportWorkerFailures(futures);
    }
    
    private void reportWorkerFailures(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            if (!future.isDone() || future.isCancelled()) {
                continue;
            }
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Worker terminated abnormally", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
    
    private boolean awaitStop(Duration period) {
        try {
            return stopSignal.await(period.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
    
    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
    
    private void record(String action, String outcome, long startNanos) {
        metricsRegistry.recordReconcile(action, outcome, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
    
    private static final class WorkerThreadFactory implements ThreadFactory {
        
        private final AtomicInteger counter = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "release-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
