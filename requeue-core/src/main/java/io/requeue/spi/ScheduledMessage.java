package io.requeue.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A message handed to a {@link MessagePublisher}.
 *
 * @param body          serialized body
 * @param contentType   MIME type of {@code body}
 * @param scheduledTime earliest instant the message may be delivered
 * @param sessionId     session affinity, or null
 * @param timeToLive    remaining lifetime on the destination, or null for the destination default
 */
public record ScheduledMessage(
        String body,
        String contentType,
        Instant scheduledTime,
        String sessionId,
        Duration timeToLive) {

    public static final String APPLICATION_JSON = "application/json";

    public ScheduledMessage {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(scheduledTime, "scheduledTime");
        if (timeToLive != null && (timeToLive.isZero() || timeToLive.isNegative())) {
            throw new IllegalArgumentException("timeToLive must be positive, got: " + timeToLive);
        }
    }

    public Optional<String> session() {
        return Optional.ofNullable(sessionId);
    }

    public Optional<Duration> ttl() {
        return Optional.ofNullable(timeToLive);
    }
}
