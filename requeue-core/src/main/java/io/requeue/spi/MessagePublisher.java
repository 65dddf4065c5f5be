package io.requeue.spi;

/**
 * Outbound half of the queue integration: schedules a message for later delivery.
 *
 * <p>Destination names and credentials belong to the implementation. The engine only
 * distinguishes success (normal return) from failure (any exception).
 *
 * @see ScheduledMessage
 */
@FunctionalInterface
public interface MessagePublisher {

    /**
     * Schedules a message on the destination queue.
     *
     * @param message the message body and its delivery attributes
     * @throws Exception if the broker rejects or cannot be reached
     */
    void scheduleMessage(ScheduledMessage message) throws Exception;
}
