package io.requeue.session;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Index of pending retries per session, used to keep retries of one session in sequence order.
 *
 * <p>A message rescheduled with session metadata is recorded here until it completes or runs out
 * of retries. A later sequence number that would otherwise overtake a pending earlier one is
 * pushed behind it.
 *
 * <p>Implementations must be thread-safe. Removal of an absent entry is a no-op, since
 * at-least-once delivery makes duplicate completions normal.
 *
 * @see InMemorySessionOrderingStore
 */
public interface SessionOrderingStore {

    /**
     * Returns the latest scheduled time among the session's entries with a lower sequence number.
     *
     * @param sessionId      the session
     * @param sequenceNumber the sequence number being scheduled
     * @return the latest scheduled time, or empty if no lower sequence is pending
     */
    Optional<Instant> latestScheduledBefore(String sessionId, long sequenceNumber);

    /**
     * Records a pending delivery. Several entries for the same sequence number may coexist.
     */
    void add(String sessionId, long sequenceNumber, Instant scheduledTime);

    /**
     * Removes the first entry for the sequence number, and the session once it has no entries.
     * Does nothing if there is no such entry.
     */
    void remove(String sessionId, long sequenceNumber);

    /**
     * Removes the entry recorded for exactly this sequence number and scheduled time, leaving
     * other entries of the same sequence in place. Does nothing if there is no such entry.
     */
    void remove(String sessionId, long sequenceNumber, Instant scheduledTime);

    /**
     * Removes every entry of a session. Does nothing for an unknown session.
     */
    void clear(String sessionId);

    /**
     * Runs {@code action} while holding the session's lock, so that a read-decide-write sequence
     * against this store is not interleaved with another for the same session.
     *
     * <p>Store operations may be called from within {@code action}.
     *
     * @param sessionId the session to lock
     * @param action    the work to run
     * @param <V>       result type
     * @return the action's result
     */
    <V> V atomically(String sessionId, Supplier<V> action);
}
