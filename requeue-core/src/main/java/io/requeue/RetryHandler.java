package io.requeue;

/**
 * User code invoked once per delivery.
 *
 * <p>Throwing any exception marks the attempt as failed and triggers the retry path. The
 * exception itself never reaches the caller of the orchestrator. Deliveries are at-least-once;
 * use {@link RetryContext#originalBindingData()} to deduplicate.
 *
 * @param <T> payload type
 * @param <R> result type
 */
@FunctionalInterface
public interface RetryHandler<T, R> {

    /**
     * Processes a payload.
     *
     * @param payload the decoded payload
     * @param context retry state and host context
     * @return the handler result, returned to the host on success
     * @throws Exception if processing fails
     */
    R handle(T payload, RetryContext context) throws Exception;
}
