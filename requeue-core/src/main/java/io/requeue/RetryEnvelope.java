package io.requeue;

import java.util.Objects;

/**
 * A payload plus the retry bookkeeping that travels with it across re-publications.
 *
 * @param payload             the handler input
 * @param originalBindingData first-delivery snapshot, never replaced
 * @param publishCount        times this logical message has been published; 1 on first delivery
 * @param <T>                 payload type
 */
public record RetryEnvelope<T>(T payload, OriginalBindingData originalBindingData, int publishCount) {

    public RetryEnvelope {
        Objects.requireNonNull(originalBindingData, "originalBindingData");
        if (publishCount < 1) {
            throw new IllegalArgumentException("publishCount must be >= 1, got: " + publishCount);
        }
    }

    /**
     * Wraps a first delivery.
     */
    public static <T> RetryEnvelope<T> first(T payload, TriggerMetadata metadata) {
        return new RetryEnvelope<>(payload, OriginalBindingData.from(metadata), 1);
    }

    /**
     * Returns the envelope for the next publication: same payload and binding data,
     * {@code publishCount + 1}.
     */
    public RetryEnvelope<T> next() {
        return new RetryEnvelope<>(payload, originalBindingData, Math.addExact(publishCount, 1));
    }
}
