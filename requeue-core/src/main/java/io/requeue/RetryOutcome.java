package io.requeue;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of processing one delivery.
 *
 * <ul>
 *   <li>{@link Succeeded} - the handler returned normally.</li>
 *   <li>{@link Rescheduled} - the handler failed and a retry was published.</li>
 *   <li>{@link Deferred} - the delivery was re-published unchanged to keep session order; the
 *       handler did not run.</li>
 *   <li>{@link Exhausted} - the handler failed and no retries were left.</li>
 *   <li>{@link Expired} - the message's deadline had passed.</li>
 *   <li>{@link Ignored} - the message had expired on arrival and was dropped.</li>
 * </ul>
 *
 * <p>{@link #orThrow()} turns the two failure variants into the engine's exceptions for hosts
 * that rely on an exception to dead-letter a message.
 *
 * @param <R> handler result type
 */
public sealed interface RetryOutcome<R> permits RetryOutcome.Succeeded, RetryOutcome.Rescheduled,
        RetryOutcome.Deferred, RetryOutcome.Exhausted, RetryOutcome.Expired, RetryOutcome.Ignored {

    /**
     * Returns the handler result, null for non-failure outcomes without a result, or throws.
     *
     * @return the handler result on {@link Succeeded}, otherwise null
     * @throws MaxRetriesReachedException on {@link Exhausted}
     * @throws MessageExpiredException    on {@link Expired}
     */
    R orThrow();

    /**
     * Handler completed.
     *
     * @param result the handler's return value, may be null
     */
    record Succeeded<R>(R result) implements RetryOutcome<R> {
        @Override
        public R orThrow() {
            return result;
        }
    }

    /**
     * A retry was published.
     *
     * @param scheduledTime when the retry becomes deliverable
     * @param publishCount  publish count carried by the retry
     */
    record Rescheduled<R>(Instant scheduledTime, int publishCount) implements RetryOutcome<R> {
        public Rescheduled {
            Objects.requireNonNull(scheduledTime, "scheduledTime");
        }

        @Override
        public R orThrow() {
            return null;
        }
    }

    /**
     * The unmodified envelope was re-published behind a lower sequence number.
     *
     * @param scheduledTime when the deferred delivery becomes deliverable
     */
    record Deferred<R>(Instant scheduledTime) implements RetryOutcome<R> {
        public Deferred {
            Objects.requireNonNull(scheduledTime, "scheduledTime");
        }

        @Override
        public R orThrow() {
            return null;
        }
    }

    /**
     * No retries left.
     *
     * @param error structured failure; its cause is the handler's last exception
     */
    record Exhausted<R>(MaxRetriesReachedException error) implements RetryOutcome<R> {
        public Exhausted {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public R orThrow() {
            throw error;
        }
    }

    /**
     * The message's original deadline had passed.
     *
     * @param error structured failure
     */
    record Expired<R>(MessageExpiredException error) implements RetryOutcome<R> {
        public Expired {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public R orThrow() {
            throw error;
        }
    }

    /**
     * The message had expired on arrival and was consumed without running the handler.
     */
    record Ignored<R>() implements RetryOutcome<R> {
        @Override
        public R orThrow() {
            return null;
        }
    }
}
