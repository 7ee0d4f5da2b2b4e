package com.platform.releasecontroller.queue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;

final class RateLimitingRetryQueueTest {

    private final RateLimitingRetryQueue<String> queue = new RateLimitingRetryQueue<>("test",
        new ExponentialFailureRateLimiter<>(Duration.ofMillis(1), Duration.ofMillis(50)));

    @AfterEach
    void tearDown() {
        queue.shutDown();
    }

    @Test
    void deduplicatesPendingKeys() {
        queue.add("a/r1");
        queue.add("a/r1");
        queue.add("a/r2");

        Assertions.assertEquals(2, queue.length());
        Assertions.assertEquals(Optional.of("a/r1"), queue.get());
        Assertions.assertEquals(Optional.of("a/r2"), queue.get());
        Assertions.assertEquals(0, queue.length());
    }

    @Test
    void keyBeingProcessedIsNotHandedOutTwice() throws Exception {
        queue.add("a/r1");
        Assertions.assertEquals("a/r1", queue.get().orElseThrow());

        queue.add("a/r1");
        Assertions.assertEquals(0, queue.length());

        CompletableFuture<Optional<String>> second = CompletableFuture.supplyAsync(queue::get);
        Thread.sleep(50);
        Assertions.assertFalse(second.isDone());

        queue.done("a/r1");
        Assertions.assertEquals(Optional.of("a/r1"), second.get(1, TimeUnit.SECONDS));
    }

    @Test
    void reAddWhileProcessingRequeuesOnceOnDone() {
        queue.add("a/r1");
        String key = queue.get().orElseThrow();

        queue.add(key);
        queue.add(key);
        queue.done(key);

        Assertions.assertEquals(1, queue.length());
        Assertions.assertEquals(Optional.of(key), queue.get());
        queue.done(key);
        Assertions.assertEquals(0, queue.length());
    }

    @Test
    void doneWithoutReAddDropsKey() {
        queue.add("a/r1");
        queue.done(queue.get().orElseThrow());

        Assertions.assertEquals(0, queue.length());
    }

    @Test
    void shutDownUnblocksWaitingConsumers() throws Exception {
        CompletableFuture<Optional<String>> waiting = CompletableFuture.supplyAsync(queue::get);
        Thread.sleep(50);

        queue.shutDown();

        Assertions.assertEquals(Optional.empty(), waiting.get(1, TimeUnit.SECONDS));
        Assertions.assertTrue(queue.isShuttingDown());
    }

    @Test
    void addsAfterShutDownAreIgnored() {
        queue.shutDown();
        queue.add("a/r1");

        Assertions.assertEquals(0, queue.length());
        Assertions.assertEquals(Optional.empty(), queue.get());
    }

    @Test
    void addAfterDelaysTheKey() {
        queue.addAfter("a/r1", Duration.ofMillis(100));
        Assertions.assertEquals(0, queue.length());

        await().atMost(Duration.ofSeconds(2)).until(() -> queue.length() == 1);
    }

    @Test
    void addAfterKeepsTheEarliestDeadline() {
        queue.addAfter("a/r1", Duration.ofSeconds(30));
        queue.addAfter("a/r1", Duration.ofMillis(20));

        await().atMost(Duration.ofSeconds(2)).until(() -> queue.length() == 1);
        queue.get();
        Assertions.assertEquals(0, queue.length());
    }

    @Test
    void addRateLimitedCountsRequeuesUntilForgotten() {
        queue.addRateLimited("a/r1");
        queue.addRateLimited("a/r1");
        Assertions.assertEquals(2, queue.numRequeues("a/r1"));

        queue.forget("a/r1");
        Assertions.assertEquals(0, queue.numRequeues("a/r1"));
        await().atMost(Duration.ofSeconds(2)).until(() -> queue.length() == 1);
    }
}
