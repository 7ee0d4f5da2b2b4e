package com.platform.releasecontroller.controller;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.platform.releasecontroller.cache.ReleaseCache;
import com.platform.releasecontroller.config.ControllerProperties;
import com.platform.releasecontroller.error.ConvergenceException;
import com.platform.releasecontroller.error.ErrorCode;
import com.platform.releasecontroller.error.LookupException;
import com.platform.releasecontroller.manager.ReleaseManager;
import com.platform.releasecontroller.model.Release;
import com.platform.releasecontroller.model.ReleaseSpec;
import com.platform.releasecontroller.observability.MetricsRegistry;
import com.platform.releasecontroller.queue.ExponentialFailureRateLimiter;
import com.platform.releasecontroller.queue.RateLimitingRetryQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

final class ReleaseControllerTest {

    private final ReleaseCache cache = mock(ReleaseCache.class);
    private final ReleaseManager manager = mock(ReleaseManager.class);
    private final MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
    private final RateLimitingRetryQueue<String> queue = new RateLimitingRetryQueue<>("test",
        new ExponentialFailureRateLimiter<>(Duration.ofMillis(1), Duration.ofMillis(20)));

    private ReleaseController controller;
    private ListAppender<ILoggingEvent> logs;
    private Logger logger;

    @BeforeEach
    void setUp() {
        ControllerProperties properties = new ControllerProperties();
        properties.setWorkers(2);
        properties.setWorkerPeriod(Duration.ofMillis(10));
        properties.setCacheSyncPollInterval(Duration.ofMillis(10));
        properties.setShutdownTimeout(Duration.ofSeconds(2));

        controller = new ReleaseController(cache, manager, queue,
            new ReleaseEventAdapter(queue, metrics), properties, metrics,
            OpenTelemetry.noop().getTracer("test"), Clock.systemUTC());

        logger = (Logger) LoggerFactory.getLogger(ReleaseController.class);
        logs = new ListAppender<>();
        logs.start();
        logger.addAppender(logs);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logs);
        queue.shutDown();
    }

    @Test
    void missingReleaseIsDeletedAndForgotten() {
        when(cache.lookup("a", "r1")).thenReturn(Optional.empty());
        queue.add("a/r1");

        Assertions.assertTrue(controller.processNextWorkItem());

        verify(manager).delete("a", "r1");
        verify(manager, never()).trigger(any());
        Assertions.assertEquals(0, queue.numRequeues("a/r1"));
        Assertions.assertEquals(0, queue.length());
        Assertions.assertEquals(1.0, metrics.getCount("controller.reconcile", "action", "delete", "outcome", "success"));
    }

    @Test
    void existingReleaseIsTriggered() {
        Release release = Release.of("a", "r1", ReleaseSpec.of("kind: ConfigMap"));
        when(cache.lookup("a", "r1")).thenReturn(Optional.of(release));
        queue.add("a/r1");

        Assertions.assertTrue(controller.processNextWorkItem());

        verify(manager).trigger(release);
        verify(manager, never()).delete(anyString(), anyString());
    }

    @Test
    void malformedKeyIsDroppedWithOneErrorRecord() throws Exception {
        queue.add("bad::key::format");

        Assertions.assertTrue(controller.processNextWorkItem());

        verifyNoInteractions(manager);
        verify(cache, never()).lookup(anyString(), anyString());
        Assertions.assertEquals(0, queue.numRequeues("bad::key::format"));
        Thread.sleep(50);
        Assertions.assertEquals(0, queue.length());
        long errors = logs.list.stream().filter(e -> e.getLevel() == Level.ERROR).count();
        Assertions.assertEquals(1, errors);
        Assertions.assertEquals(1, controller.getStatus().dropped());
    }

    @Test
    void lookupFailureIsRetried() {
        when(cache.lookup("a", "r1")).thenThrow(new LookupException("a", "r1", new IllegalStateException("down")));
        queue.add("a/r1");

        Assertions.assertFalse(controller.processNextWorkItem());

        verifyNoInteractions(manager);
        Assertions.assertEquals(1, queue.numRequeues("a/r1"));
        await().atMost(Duration.ofSeconds(2)).until(() -> queue.length() == 1);
    }

    @Test
    void convergenceFailureIsRetriedThenForgottenOnSuccess() {
        Release release = Release.of("a", "r1", ReleaseSpec.of("kind: ConfigMap"));
        when(cache.lookup("a", "r1")).thenReturn(Optional.of(release));
        doThrow(new ConvergenceException(ErrorCode.APPLY_FAILED, "a/r1", "apply failed"))
            .doNothing()
            .when(manager).trigger(release);
        queue.add("a/r1");

        Assertions.assertFalse(controller.processNextWorkItem());
        Assertions.assertEquals(1, queue.numRequeues("a/r1"));

        await().atMost(Duration.ofSeconds(2)).until(() -> queue.length() == 1);
        Assertions.assertTrue(controller.processNextWorkItem());
        Assertions.assertEquals(0, queue.numRequeues("a/r1"));
        Assertions.assertEquals(1, controller.getStatus().failed());
        Assertions.assertEquals(1, controller.getStatus().reconciled());
    }

    @Test
    void unexpectedExceptionDoesNotEscapeTheLoop() {
        when(cache.lookup("a", "r1")).thenReturn(Optional.of(Release.of("a", "r1", ReleaseSpec.of("x"))));
        doThrow(new NullPointerException("bug")).when(manager).trigger(any());
        queue.add("a/r1");

        Assertions.assertFalse(controller.processNextWorkItem());
        Assertions.assertEquals(1, queue.numRequeues("a/r1"));
    }

    @Test
    void errorFromManagerIsRequeued() {
        when(cache.lookup("a", "r1")).thenReturn(Optional.of(Release.of("a", "r1", ReleaseSpec.of("x"))));
        doThrow(new ExceptionInInitializerError("static init failed")).when(manager).trigger(any());
        queue.add("a/r1");

        Assertions.assertFalse(controller.processNextWorkItem());
        Assertions.assertEquals(1, queue.numRequeues("a/r1"));
        Assertions.assertEquals(1, controller.getStatus().failed());
        Assertions.assertTrue(logs.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
            && e.getFormattedMessage().contains("a/r1")));
    }

    @Test
    void workerKeepsReconcilingAfterAnError() throws Exception {
        ControllerProperties single = new ControllerProperties();
        single.setWorkers(1);
        single.setWorkerPeriod(Duration.ofMillis(10));
        single.setCacheSyncPollInterval(Duration.ofMillis(10));
        single.setShutdownTimeout(Duration.ofSeconds(2));
        ReleaseController singleWorker = new ReleaseController(cache, manager, queue,
            new ReleaseEventAdapter(queue, metrics), single, metrics,
            OpenTelemetry.noop().getTracer("test"), Clock.systemUTC());

        Release first = Release.of("a", "r1", ReleaseSpec.of("kind: ConfigMap"));
        Release second = Release.of("a", "r2", ReleaseSpec.of("kind: ConfigMap"));
        when(cache.hasSynced()).thenReturn(true);
        when(cache.lookup("a", "r1")).thenReturn(Optional.of(first));
        when(cache.lookup("a", "r2")).thenReturn(Optional.of(second));
        doThrow(new ExceptionInInitializerError("static init failed"))
            .doNothing()
            .when(manager).trigger(first);
        queue.add("a/r1");
        CountDownLatch stop = new CountDownLatch(1);

        Thread runner = new Thread(() -> singleWorker.run(stop));
        runner.start();

        verify(manager, timeout(2000).times(2)).trigger(first);
        queue.add("a/r2");
        verify(manager, timeout(2000)).trigger(second);
        await().atMost(Duration.ofSeconds(2)).until(() -> queue.numRequeues("a/r1") == 0);
        await().atMost(Duration.ofSeconds(2)).until(() -> singleWorker.getStatus().isReady());
        Assertions.assertEquals(1, singleWorker.getStatus().workers());

        stop.countDown();
        runner.join(TimeUnit.SECONDS.toMillis(5));
        Assertions.assertFalse(runner.isAlive());
        Assertions.assertEquals(0, singleWorker.getStatus().workers());
    }

    @Test
    void sweepRunsBeforeFirstTrigger() throws Exception {
        Release release = Release.of("a", "r1", ReleaseSpec.of("kind: ConfigMap"));
        when(cache.hasSynced()).thenReturn(true);
        when(cache.lookup("a", "r1")).thenReturn(Optional.of(release));
        queue.add("a/r1");
        CountDownLatch stop = new CountDownLatch(1);

        Thread runner = new Thread(() -> controller.run(stop));
        runner.start();

        verify(manager, timeout(2000)).trigger(release);
        InOrder order = inOrder(manager);
        order.verify(manager).run();
        order.verify(manager).trigger(release);
        await().atMost(Duration.ofSeconds(2))
            .until(() -> controller.getPhase() == ReleaseController.Phase.RUNNING);
        Assertions.assertTrue(controller.getStatus().isReady());

        stop.countDown();
        runner.join(TimeUnit.SECONDS.toMillis(5));
        Assertions.assertFalse(runner.isAlive());
        Assertions.assertEquals(ReleaseController.Phase.STOPPED, controller.getPhase());
        Assertions.assertTrue(queue.isShuttingDown());
    }

    @Test
    void noWorkersStartWithoutCacheSync() throws Exception {
        when(cache.hasSynced()).thenReturn(false);
        queue.add("a/r1");
        CountDownLatch stop = new CountDownLatch(1);

        Thread runner = new Thread(() -> controller.run(stop));
        runner.start();
        await().atMost(Duration.ofSeconds(2))
            .until(() -> controller.getPhase() == ReleaseController.Phase.WAITING_FOR_SYNC);
        Thread.sleep(100);

        stop.countDown();
        runner.join(TimeUnit.SECONDS.toMillis(5));

        Assertions.assertFalse(runner.isAlive());
        verifyNoInteractions(manager);
        Assertions.assertEquals(ReleaseController.Phase.STOPPED, controller.getPhase());
        Assertions.assertTrue(logs.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
            && e.getFormattedMessage().contains(ErrorCode.STARTUP_SYNC_FAILED.getCode())));
    }

    @Test
    void sweepFailureDoesNotBlockStartup() throws Exception {
        when(cache.hasSynced()).thenReturn(true);
        when(cache.lookup("a", "r1")).thenReturn(Optional.empty());
        when(manager.run()).thenThrow(new ConvergenceException(ErrorCode.SWEEP_FAILED, "*", "list failed"));
        queue.add("a/r1");
        CountDownLatch stop = new CountDownLatch(1);

        Thread runner = new Thread(() -> controller.run(stop));
        runner.start();

        verify(manager, timeout(2000)).delete("a", "r1");
        Assertions.assertEquals(1.0, metrics.getCount("controller.sweep", "outcome", "failure"));

        stop.countDown();
        runner.join(TimeUnit.SECONDS.toMillis(5));
        Assertions.assertFalse(runner.isAlive());
    }

    @Test
    void runCanOnlyBeCalledOnce() throws Exception {
        when(cache.hasSynced()).thenReturn(true);
        CountDownLatch stop = new CountDownLatch(1);
        stop.countDown();

        controller.run(stop);

        Assertions.assertThrows(IllegalStateException.class, () -> controller.run(new CountDownLatch(1)));
    }
}
