package io.requeue;

/**
 * Per-delivery metadata supplied by the host trigger runtime.
 *
 * <p>All fields are optional. Timestamps are kept as the exact text the runtime sent so that
 * they can be copied into retry envelopes unchanged.
 *
 * @param messageId      broker message id of this delivery
 * @param enqueuedAt     when the broker accepted this delivery
 * @param expiresAt      when the broker will drop this delivery
 * @param sessionId      session the delivery belongs to
 * @param sequenceNumber broker-assigned position of the delivery
 */
public record TriggerMetadata(
        String messageId,
        String enqueuedAt,
        String expiresAt,
        String sessionId,
        Long sequenceNumber) {

    private static final TriggerMetadata EMPTY = new TriggerMetadata(null, null, null, null, null);

    /**
     * Returns metadata with every field absent.
     */
    public static TriggerMetadata empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link TriggerMetadata}. */
    public static final class Builder {
        private String messageId;
        private String enqueuedAt;
        private String expiresAt;
        private String sessionId;
        private Long sequenceNumber;

        private Builder() {}

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder enqueuedAt(String enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }

        public Builder expiresAt(String expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder sequenceNumber(Long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public TriggerMetadata build() {
            return new TriggerMetadata(messageId, enqueuedAt, expiresAt, sessionId, sequenceNumber);
        }
    }
}
