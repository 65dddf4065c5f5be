package io.requeue;

/**
 * Thrown when a delivery fails and its retry budget is spent.
 *
 * <p>The handler's last failure is attached as the cause.
 */
public final class MaxRetriesReachedException extends RetryEngineException {

    private final String originalMessageId;
    private final String currentMessageId;
    private final int publishCount;

    public MaxRetriesReachedException(String originalMessageId, String currentMessageId,
                                      int publishCount, Throwable lastFailure) {
        super("Max retries reached after " + publishCount + " deliveries (original id "
                + originalMessageId + ", current id " + currentMessageId + ")", lastFailure);
        this.originalMessageId = originalMessageId;
        this.currentMessageId = currentMessageId;
        this.publishCount = publishCount;
    }

    public String originalMessageId() {
        return originalMessageId;
    }

    public String currentMessageId() {
        return currentMessageId;
    }

    /**
     * Returns how many times the message had been published when it was given up on.
     */
    public int publishCount() {
        return publishCount;
    }
}
