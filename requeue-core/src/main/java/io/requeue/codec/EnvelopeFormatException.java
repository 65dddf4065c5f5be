package io.requeue.codec;

/**
 * Thrown when a body cannot be decoded into a delivery, or an envelope cannot be encoded.
 */
public class EnvelopeFormatException extends IllegalArgumentException {

    public EnvelopeFormatException(String message) {
        super(message);
    }

    public EnvelopeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
