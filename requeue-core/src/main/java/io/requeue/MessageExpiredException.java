package io.requeue;

import java.time.Instant;

/**
 * Thrown when a message's original deadline has passed before it could be re-published.
 *
 * <p>No retry is scheduled once this is raised.
 */
public final class MessageExpiredException extends RetryEngineException {

    private final String originalMessageId;
    private final String currentMessageId;
    private final Instant expiresAt;

    public MessageExpiredException(String originalMessageId, String currentMessageId, Instant expiresAt) {
        super("Message expired at " + expiresAt + " (original id " + originalMessageId
                + ", current id " + currentMessageId + ")");
        this.originalMessageId = originalMessageId;
        this.currentMessageId = currentMessageId;
        this.expiresAt = expiresAt;
    }

    /**
     * Returns the id the message had on first delivery, or null if the runtime supplied none.
     */
    public String originalMessageId() {
        return originalMessageId;
    }

    /**
     * Returns the id of the delivery being handled, or null if the runtime supplied none.
     */
    public String currentMessageId() {
        return currentMessageId;
    }

    public Instant expiresAt() {
        return expiresAt;
    }
}
