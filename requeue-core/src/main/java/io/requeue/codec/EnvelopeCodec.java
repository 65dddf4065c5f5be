package io.requeue.codec;

import io.requeue.Delivery;
import io.requeue.RetryEnvelope;

import java.lang.reflect.Type;

/**
 * Converts message bodies to {@link Delivery} values and retry envelopes to bodies.
 *
 * <p>The wire form of a retry is a JSON object tagged {@code "kind":"retry"}:
 * <pre>{@code
 * {"kind":"retry","payload":...,"originalBindingData":{"messageId":"...",...},"publishCount":2}
 * }</pre>
 * An object without a {@code kind} field that still carries an integral {@code publishCount}
 * and an {@code originalBindingData} object is read as an untagged retry envelope. Any other
 * body, including one whose {@code kind} is not {@code "retry"}, is a first delivery.
 *
 * @see #getDefault()
 * @see JacksonEnvelopeCodec
 */
public interface EnvelopeCodec {

    /** Value of the {@code kind} discriminator on retry envelopes. */
    String RETRY_KIND = "retry";

    /**
     * Returns the shared Jackson-backed codec.
     *
     * @return the default {@link EnvelopeCodec}
     */
    static EnvelopeCodec getDefault() {
        return JacksonEnvelopeCodec.INSTANCE;
    }

    /**
     * Decodes a body.
     *
     * @param body        the raw body
     * @param payloadType type to bind the payload to
     * @param <T>         payload type
     * @return a {@link Delivery.RetryDelivery} for a retry envelope, otherwise a
     *         {@link Delivery.FirstDelivery}
     * @throws EnvelopeFormatException if the body or the payload cannot be bound
     */
    <T> Delivery<T> decode(String body, Type payloadType);

    /**
     * Encodes a retry envelope for publication.
     *
     * @param envelope the envelope
     * @return the JSON body
     * @throws EnvelopeFormatException if the payload cannot be serialized
     */
    String encode(RetryEnvelope<?> envelope);
}
