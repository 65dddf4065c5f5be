package io.requeue.session;

import java.time.Instant;
import java.util.Objects;

/**
 * A pending delivery of one sequence number within a session.
 *
 * @param sequenceNumber broker sequence number of the message
 * @param scheduledTime  when the pending delivery becomes deliverable
 */
public record ScheduledEntry(long sequenceNumber, Instant scheduledTime) {

    public ScheduledEntry {
        Objects.requireNonNull(scheduledTime, "scheduledTime");
    }
}
