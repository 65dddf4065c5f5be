package io.requeue.expiry;

import io.requeue.OriginalBindingData;
import io.requeue.RetryConfiguration;
import io.requeue.util.UtcTimestamps;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a chain of retries bound to the original message's deadline.
 *
 * <p>Each retry is published with a time-to-live equal to whatever is left of the first
 * delivery's lifetime at the retry's scheduled time, so the chain expires at the original
 * deadline however many hops it takes. A retry that would only become visible at or after the
 * deadline is not published.
 *
 * <p>A deadline the runtime sent in a form that cannot be parsed is logged and treated as absent.
 */
public final class ExpiryGuard {
    private static final Logger logger = Logger.getLogger(ExpiryGuard.class.getName());

    /**
     * Decides the time-to-live for a delivery that becomes visible at {@code at}.
     *
     * @param config  retry settings; {@code preserveExpiry} switches the guard off
     * @param binding first-delivery metadata holding the original deadline
     * @param at      when the delivery becomes visible
     * @return {@link ExpiryDecision.NoTimeToLive} when expiry is not preserved or unknown,
     *         {@link ExpiryDecision.Expired} when the deadline is at or before {@code at},
     *         else {@link ExpiryDecision.TimeToLive}
     */
    public ExpiryDecision apply(RetryConfiguration config, OriginalBindingData binding, Instant at) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(at, "at");
        if (!config.preserveExpiry()) {
            return ExpiryDecision.NO_TIME_TO_LIVE;
        }
        Optional<Instant> expiresAt = expiresAt(binding);
        if (expiresAt.isEmpty()) {
            return ExpiryDecision.NO_TIME_TO_LIVE;
        }
        Duration remaining = Duration.between(at, expiresAt.get());
        if (remaining.isZero() || remaining.isNegative()) {
            return new ExpiryDecision.Expired(expiresAt.get());
        }
        return new ExpiryDecision.TimeToLive(remaining);
    }

    /**
     * Returns true when the binding data records a deadline at or before {@code now}.
     */
    public boolean isExpired(OriginalBindingData binding, Instant now) {
        Objects.requireNonNull(now, "now");
        return expiresAt(binding).map(deadline -> !deadline.isAfter(now)).orElse(false);
    }

    /**
     * Returns the parsed original deadline, empty if none was recorded or it cannot be parsed.
     */
    public Optional<Instant> expiresAt(OriginalBindingData binding) {
        if (binding == null || binding.expiresAt() == null || binding.expiresAt().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UtcTimestamps.parse(binding.expiresAt()));
        } catch (IllegalArgumentException e) {
            logger.log(Level.WARNING, "Ignoring unparseable expiresAt '" + binding.expiresAt()
                    + "' for originalId=" + binding.messageId(), e);
            return Optional.empty();
        }
    }
}
