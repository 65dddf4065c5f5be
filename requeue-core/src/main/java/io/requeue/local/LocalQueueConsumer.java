package io.requeue.local;

import io.requeue.RetryOrchestrator;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker pool that plays the host trigger runtime for an {@link InMemoryQueue}.
 *
 * <p>Each worker takes due messages off the queue and passes them to
 * {@link RetryOrchestrator#execute}. A message whose invocation throws (retries exhausted, deadline
 * passed, publish failure, undecodable body) is dead-lettered under the exception's simple class
 * name; anything else is consumed.
 *
 * <p>Create instances via {@link #builder()}; workers start on {@link Builder#build()}.
 * {@link #close()} stops taking messages and waits for in-flight invocations up to the drain
 * timeout.
 */
public final class LocalQueueConsumer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(LocalQueueConsumer.class.getName());

    private final InMemoryQueue queue;
    private final RetryOrchestrator<?, ?> orchestrator;
    private final ExecutorService workers;
    private final long pollTimeoutMs;
    private final long drainTimeoutMs;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicInteger workerIds = new AtomicInteger();

    private LocalQueueConsumer(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.orchestrator = Objects.requireNonNull(builder.orchestrator, "orchestrator");
        if (builder.workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        if (builder.pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("pollTimeoutMs must be > 0");
        }
        if (builder.drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.pollTimeoutMs = builder.pollTimeoutMs;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.workers = Executors.newFixedThreadPool(builder.workerCount, this::newWorker);
        for (int i = 0; i < builder.workerCount; i++) {
            workers.submit(this::workerLoop);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // daemon, so a consumer that is never closed does not hold the JVM open
    private Thread newWorker(Runnable task) {
        Thread worker = new Thread(task, "requeue-" + queue.name() + "-" + workerIds.incrementAndGet());
        worker.setDaemon(true);
        return worker;
    }

    private void workerLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<QueuedMessage> message = queue.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
                if (message.isPresent()) {
                    deliver(message.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Consumer loop error on " + queue.name(), t);
            }
        }
    }

    private void deliver(QueuedMessage message) {
        try {
            orchestrator.execute(message.toInbound());
            completed.incrementAndGet();
        } catch (RuntimeException e) {
            queue.deadLetter(message, e.getClass().getSimpleName(), e.getMessage());
            deadLettered.incrementAndGet();
            logger.log(Level.WARNING, "Dead-lettered " + message.messageId() + " on " + queue.name(), e);
        }
    }

    /**
     * Returns the number of deliveries consumed without dead-lettering.
     */
    public long completedCount() {
        return completed.get();
    }

    /**
     * Returns the number of deliveries this consumer dead-lettered.
     */
    public long deadLetteredCount() {
        return deadLettered.get();
    }

    /**
     * Stops polling, lets in-flight deliveries finish within the drain timeout, then shuts the
     * workers down.
     */
    @Override
    public void close() {
        running.set(false);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeoutMs + pollTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded on " + queue.name() + "; forcing shutdown");
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link LocalQueueConsumer}. */
    public static final class Builder {
        private InMemoryQueue queue;
        private RetryOrchestrator<?, ?> orchestrator;
        private int workerCount = 2;
        private long pollTimeoutMs = 50;
        private long drainTimeoutMs = 5000;

        private Builder() {}

        /**
         * <p><b>Required.</b>
         *
         * @param queue the queue to consume
         * @return this builder
         */
        public Builder queue(InMemoryQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Sets the orchestrator deliveries are handed to. It should publish retries back onto the
         * same queue.
         *
         * <p><b>Required.</b>
         *
         * @param orchestrator the orchestrator
         * @return this builder
         */
        public Builder orchestrator(RetryOrchestrator<?, ?> orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 2}. Must be &ge; 1.
         *
         * @param workerCount number of worker threads
         * @return this builder
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 50} ms.
         *
         * @param pollTimeoutMs how long a worker waits for a due message before re-checking shutdown
         * @return this builder
         */
        public Builder pollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param drainTimeoutMs how long {@link #close()} waits for in-flight deliveries
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds the consumer and starts its workers.
         *
         * @return the running consumer
         */
        public LocalQueueConsumer build() {
            return new LocalQueueConsumer(this);
        }
    }
}
