package io.requeue.expiry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * What the {@link ExpiryGuard} decided for a retry about to be published.
 */
public sealed interface ExpiryDecision
        permits ExpiryDecision.NoTimeToLive, ExpiryDecision.TimeToLive, ExpiryDecision.Expired {

    NoTimeToLive NO_TIME_TO_LIVE = new NoTimeToLive();

    /**
     * Publish without a time-to-live; the destination's default applies.
     */
    record NoTimeToLive() implements ExpiryDecision {
    }

    /**
     * Publish with the given remaining lifetime.
     *
     * @param remaining time left until the original deadline, always positive
     */
    record TimeToLive(Duration remaining) implements ExpiryDecision {
        public TimeToLive {
            Objects.requireNonNull(remaining, "remaining");
            if (remaining.isZero() || remaining.isNegative()) {
                throw new IllegalArgumentException("remaining must be positive, got: " + remaining);
            }
        }
    }

    /**
     * The original deadline has passed; the message must not be published again.
     *
     * @param expiresAt the original deadline
     */
    record Expired(Instant expiresAt) implements ExpiryDecision {
        public Expired {
            Objects.requireNonNull(expiresAt, "expiresAt");
        }
    }
}
