package io.requeue;

/**
 * Wraps a failure of the outbound {@link io.requeue.spi.MessagePublisher}.
 *
 * <p>Any session ordering entry recorded for the failed publish has already been removed
 * when this is thrown.
 */
public class MessagePublishException extends RuntimeException {

    public MessagePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
