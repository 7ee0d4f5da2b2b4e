package com.platform.releasecontroller.controller;

import com.platform.releasecontroller.config.ControllerProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Binds the release controller to the application lifecycle.
 * 
 * Order:
 * 1. Application ready: start the controller thread
 * 2. Context closing: fire the stop signal
 * 3. Wait for the controller to drain its workers
 */
@Slf4j
@Component
public class ControllerRunner implements ApplicationListener<ContextClosedEvent> {
    
    private static final Duration JOIN_GRACE = Duration.ofSeconds(5);
    
    private final ReleaseController controller;
    private final ControllerProperties properties;
    
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private volatile Thread controllerThread;
    
    public ControllerRunner(ReleaseController controller, ControllerProperties properties) {
        this.controller = controller;
        this.properties = properties;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!properties.isEnabled()) {
            log.info("Release controller is disabled");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::runController, "release-controller");
        thread.setDaemon(true);
        controllerThread = thread;
        thread.start();
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        stop();
    }
    
    @PreDestroy
    public void onPreDestroy() {
        stop();
    }
    
    /**
     * Fire the stop signal and wait for the controller thread to finish.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        Instant begin = Instant.now();
        stopSignal.countDown();
        
        Thread thread = controllerThread;
        if (thread == null) {
            return;
        }
        try {
            thread.join(properties.getShutdownTimeout().plus(JOIN_GRACE).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the release controller to stop");
            return;
        }
        if (thread.isAlive()) {
            log.warn("Release controller did not stop within {} ms", Duration.between(begin, Instant.now()).toMillis());
        } else {
            log.info("Release controller shut down in {} ms", Duration.between(begin, Instant.now()).toMillis());
        }
    }
    
    private void runController() {
        try {
            controller.run(stopSignal);
        } catch (RuntimeException e) {
            log.error("Release controller terminated unexpectedly", e);
        }
    }
}
