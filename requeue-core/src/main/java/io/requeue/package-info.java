/**
 * Retry-with-backoff orchestration for at-least-once queue consumers.
 *
 * <p>{@link io.requeue.RetryOrchestrator} wraps a {@link io.requeue.RetryHandler}. On failure it
 * re-publishes the message as a {@link io.requeue.RetryEnvelope} with a computed delay, an
 * incremented publish count, and optionally the original deadline and per-session ordering.
 * {@link io.requeue.RetryEngine} shares components between streams.
 *
 * @see io.requeue.RetryOrchestrator
 * @see io.requeue.RetryConfiguration
 * @see io.requeue.RetryOutcome
 */
package io.requeue;
