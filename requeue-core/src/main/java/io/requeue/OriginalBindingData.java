package io.requeue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Snapshot of the first delivery's metadata, carried unchanged through every retry.
 *
 * <p>Absent fields are omitted from the wire form.
 *
 * @param messageId      id of the first delivery
 * @param enqueuedAt     enqueue time of the first delivery
 * @param expiresAt      original deadline of the message
 * @param sessionId      session the message belongs to
 * @param sequenceNumber position of the first delivery in its session
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OriginalBindingData(
        String messageId,
        String enqueuedAt,
        String expiresAt,
        String sessionId,
        Long sequenceNumber) {

    /**
     * Captures the binding data of a first delivery.
     *
     * @param metadata metadata of the first delivery
     * @return the snapshot
     */
    public static OriginalBindingData from(TriggerMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        return new OriginalBindingData(
                metadata.messageId(),
                metadata.enqueuedAt(),
                metadata.expiresAt(),
                metadata.sessionId(),
                metadata.sequenceNumber());
    }

    /**
     * Returns true when both a session id and a sequence number were recorded, which is what
     * session ordering needs.
     */
    public boolean hasSession() {
        return sessionId != null && sequenceNumber != null;
    }
}
