package io.requeue.local;

import io.requeue.RetryConfiguration;
import io.requeue.RetryOrchestrator;
import io.requeue.session.InMemorySessionOrderingStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalQueueConsumerTest {

    private static RetryConfiguration.Builder quickRetries() {
        return RetryConfiguration.builder().maxRetries(3).baseDelay(Duration.ofMillis(20));
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void failingMessageRetriedUntilItSucceeds() throws Exception {
        InMemoryQueue queue = new InMemoryQueue("orders");
        List<Integer> publishCounts = new CopyOnWriteArrayList<>();
        Set<String> originalIds = ConcurrentHashMap.newKeySet();
        CountDownLatch succeeded = new CountDownLatch(1);
        RetryOrchestrator<String, Void> orchestrator = RetryOrchestrator.builder(String.class)
                .configuration(quickRetries().build())
                .publisher(queue)
                .build((payload, ctx) -> {
                    publishCounts.add(ctx.publishCount());
                    originalIds.add(ctx.originalBindingData().messageId());
                    if (ctx.publishCount() < 3) {
                        throw new IllegalStateException("not yet");
                    }
                    succeeded.countDown();
                    return null;
                });

        try (LocalQueueConsumer consumer = LocalQueueConsumer.builder()
                .queue(queue)
                .orchestrator(orchestrator)
                .workerCount(1)
                .build()) {
            queue.send("order-1");

            assertTrue(succeeded.await(5, TimeUnit.SECONDS));
            awaitCondition(() -> consumer.completedCount() == 3);
        }

        assertEquals(List.of(1, 2, 3), publishCounts);
        assertEquals(1, originalIds.size());
        assertTrue(queue.deadLetters().isEmpty());
    }

    @Test
    void exhaustedMessageDeadLettered() throws Exception {
        InMemoryQueue queue = new InMemoryQueue("payments");
        RetryOrchestrator<String, Void> orchestrator = RetryOrchestrator.builder(String.class)
                .configuration(quickRetries().maxRetries(1).build())
                .publisher(queue)
                .build((payload, ctx) -> {
                    throw new IllegalStateException("always");
                });

        LocalQueueConsumer consumer = LocalQueueConsumer.builder()
                .queue(queue)
                .orchestrator(orchestrator)
                .build();
        try {
            queue.send("payment-1");
            awaitCondition(() -> queue.deadLetters().size() == 1);
        } finally {
            consumer.close();
        }

        assertEquals(1, consumer.deadLetteredCount());

        DeadLetter deadLetter = queue.deadLetters().get(0);
        assertEquals("MaxRetriesReachedException", deadLetter.reason());
        assertTrue(deadLetter.message().body().contains("\"publishCount\":2"));
    }

    @Test
    void sessionRetriesDeliveredInSequenceOrder() throws Exception {
        InMemoryQueue queue = new InMemoryQueue("sessions");
        List<String> handled = new CopyOnWriteArrayList<>();
        Set<String> failedOnce = ConcurrentHashMap.newKeySet();
        CountDownLatch done = new CountDownLatch(3);
        RetryOrchestrator<String, Void> orchestrator = RetryOrchestrator.builder(String.class)
                .configuration(quickRetries()
                        .baseDelay(Duration.ofMillis(200))
                        .preserveSessionOrdering(true)
                        .sessionOrderingIncrement(Duration.ofMillis(50))
                        .build())
                .publisher(queue)
                .sessionStore(new InMemorySessionOrderingStore())
                .build((payload, ctx) -> {
                    if (payload.equals("first") && failedOnce.add(payload)) {
                        throw new IllegalStateException("transient");
                    }
                    handled.add(payload);
                    done.countDown();
                    return null;
                });

        try (LocalQueueConsumer consumer = LocalQueueConsumer.builder()
                .queue(queue)
                .orchestrator(orchestrator)
                .workerCount(1)
                .build()) {
            queue.send("first", "s");
            queue.send("second", "s");
            queue.send("third", "s");

            assertTrue(done.await(5, TimeUnit.SECONDS));
        }

        assertEquals(List.of("first", "second", "third"), handled);
    }

    @Test
    void handlerErrorDeadLetteredOnceRetriesRunOut() throws Exception {
        InMemoryQueue queue = new InMemoryQueue("errors");
        RetryOrchestrator<String, Void> orchestrator = RetryOrchestrator.builder(String.class)
                .configuration(quickRetries().maxRetries(1).build())
                .publisher(queue)
                .build((payload, ctx) -> {
                    throw new AssertionError("handler bug");
                });

        LocalQueueConsumer consumer = LocalQueueConsumer.builder()
                .queue(queue)
                .orchestrator(orchestrator)
                .build();
        try {
            queue.send("e-1");
            awaitCondition(() -> queue.deadLetters().size() == 1);
        } finally {
            consumer.close();
        }

        assertEquals("MaxRetriesReachedException", queue.deadLetters().get(0).reason());
        assertEquals(1, consumer.completedCount());
    }

    @Test
    void workersAreNamedDaemonThreads() throws Exception {
        InMemoryQueue queue = new InMemoryQueue("named");
        List<Thread> threads = new CopyOnWriteArrayList<>();
        CountDownLatch handled = new CountDownLatch(1);
        RetryOrchestrator<String, Void> orchestrator = RetryOrchestrator.builder(String.class)
                .configuration(quickRetries().build())
                .publisher(queue)
                .build((payload, ctx) -> {
                    threads.add(Thread.currentThread());
                    handled.countDown();
                    return null;
                });

        try (LocalQueueConsumer consumer = LocalQueueConsumer.builder()
                .queue(queue)
                .orchestrator(orchestrator)
                .workerCount(1)
                .build()) {
            queue.send("n-1");
            assertTrue(handled.await(5, TimeUnit.SECONDS));
        }

        assertEquals("requeue-named-1", threads.get(0).getName());
        assertTrue(threads.get(0).isDaemon());
    }

    @Test
    void builderValidation() {
        InMemoryQueue queue = new InMemoryQueue("q");
        assertThrows(NullPointerException.class, () -> LocalQueueConsumer.builder().queue(queue).build());
        RetryOrchestrator<String, Object> orchestrator = RetryOrchestrator.builder(String.class)
                .configuration(quickRetries().build())
                .publisher(queue)
                .build((payload, ctx) -> payload);
        assertThrows(IllegalArgumentException.class, () ->
                LocalQueueConsumer.builder().queue(queue).orchestrator(orchestrator).workerCount(0).build());
    }
}
