package io.requeue;

import java.util.Objects;

/**
 * A decoded inbound body: either a first delivery or a retry carrying an envelope.
 *
 * @param <T> payload type
 * @see io.requeue.codec.EnvelopeCodec
 */
public sealed interface Delivery<T> permits Delivery.FirstDelivery, Delivery.RetryDelivery {

    /**
     * Returns the retry state for this delivery, synthesizing it from {@code metadata} on a first
     * delivery.
     *
     * @param metadata the current delivery's metadata
     * @return the envelope to work with
     */
    RetryEnvelope<T> toEnvelope(TriggerMetadata metadata);

    /**
     * A body that is not a retry envelope.
     *
     * @param payload decoded payload
     */
    record FirstDelivery<T>(T payload) implements Delivery<T> {
        @Override
        public RetryEnvelope<T> toEnvelope(TriggerMetadata metadata) {
            return RetryEnvelope.first(payload, metadata);
        }
    }

    /**
     * A body tagged as a retry envelope.
     *
     * @param envelope the restored envelope
     */
    record RetryDelivery<T>(RetryEnvelope<T> envelope) implements Delivery<T> {
        public RetryDelivery {
            Objects.requireNonNull(envelope, "envelope");
        }

        @Override
        public RetryEnvelope<T> toEnvelope(TriggerMetadata metadata) {
            return envelope;
        }
    }
}
