package io.requeue.local;

import java.time.Instant;
import java.util.Objects;

/**
 * A message moved to the dead-letter list of an {@link InMemoryQueue}.
 *
 * @param message      the message
 * @param reason       short machine-readable reason: {@link #EXPIRED}, or the simple class name of
 *                     the exception that failed the delivery
 * @param description  human-readable detail, may be null
 * @param deadLetteredAt when the message was dead-lettered
 */
public record DeadLetter(QueuedMessage message, String reason, String description, Instant deadLetteredAt) {

    /** The message's time-to-live elapsed before delivery. */
    public static final String EXPIRED = "TTLExpiredException";

    public DeadLetter {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(deadLetteredAt, "deadLetteredAt");
    }
}
