package io.requeue.local;

import io.requeue.InboundMessage;
import io.requeue.TriggerMetadata;
import io.requeue.util.UtcTimestamps;

import java.time.Instant;
import java.util.Objects;

/**
 * A message held by an {@link InMemoryQueue}.
 *
 * @param messageId      ULID assigned on enqueue
 * @param sequenceNumber queue-wide position, increasing with every enqueue
 * @param body           message body
 * @param contentType    MIME type of {@code body}
 * @param enqueuedAt     when the message was accepted
 * @param scheduledTime  earliest delivery time
 * @param expiresAt      when the queue drops the message, or null for never
 * @param sessionId      session the message belongs to, or null
 */
public record QueuedMessage(
        String messageId,
        long sequenceNumber,
        String body,
        String contentType,
        Instant enqueuedAt,
        Instant scheduledTime,
        Instant expiresAt,
        String sessionId) {

    public QueuedMessage {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        Objects.requireNonNull(scheduledTime, "scheduledTime");
    }

    /**
     * Returns the trigger metadata a broker runtime would report for this message.
     */
    public TriggerMetadata toMetadata() {
        return TriggerMetadata.builder()
                .messageId(messageId)
                .enqueuedAt(UtcTimestamps.format(enqueuedAt))
                .expiresAt(expiresAt == null ? null : UtcTimestamps.format(expiresAt))
                .sessionId(sessionId)
                .sequenceNumber(sequenceNumber)
                .build();
    }

    /**
     * Wraps this message as a delivery for an orchestrator.
     */
    public InboundMessage toInbound() {
        return InboundMessage.of(body, toMetadata());
    }
}
