package io.requeue.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Process-local {@link SessionOrderingStore}.
 *
 * <p>Entries live in a map from session id to an unordered list; a session with no entries has
 * no key. Every operation runs under one of a fixed set of {@link ReentrantLock}s chosen by the
 * session id's hash, so sessions on different stripes never contend. Locks are reentrant, which
 * lets store calls nest inside {@link #atomically}.
 *
 * <p>Nothing is persisted: the state is lost on restart, and separate processes do not see each
 * other's entries.
 *
 * <p>This class is thread-safe.
 */
public final class InMemorySessionOrderingStore implements SessionOrderingStore {
    public static final int DEFAULT_LOCK_STRIPES = 64;

    private final Map<String, List<ScheduledEntry>> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock[] stripes;

    public InMemorySessionOrderingStore() {
        this(DEFAULT_LOCK_STRIPES);
    }

    /**
     * @param lockStripes number of locks sessions are spread across; 1 gives a single global lock
     */
    public InMemorySessionOrderingStore(int lockStripes) {
        if (lockStripes < 1) {
            throw new IllegalArgumentException("lockStripes must be >= 1, got: " + lockStripes);
        }
        this.stripes = new ReentrantLock[lockStripes];
        for (int i = 0; i < lockStripes; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public Optional<Instant> latestScheduledBefore(String sessionId, long sequenceNumber) {
        return atomically(sessionId, () -> {
            List<ScheduledEntry> entries = sessions.get(sessionId);
            if (entries == null) {
                return Optional.empty();
            }
            Instant latest = null;
            for (ScheduledEntry entry : entries) {
                if (entry.sequenceNumber() < sequenceNumber
                        && (latest == null || entry.scheduledTime().isAfter(latest))) {
                    latest = entry.scheduledTime();
                }
            }
            return Optional.ofNullable(latest);
        });
    }

    @Override
    public void add(String sessionId, long sequenceNumber, Instant scheduledTime) {
        ScheduledEntry entry = new ScheduledEntry(sequenceNumber, scheduledTime);
        atomically(sessionId, () -> sessions.computeIfAbsent(sessionId, k -> new ArrayList<>()).add(entry));
    }

    @Override
    public void remove(String sessionId, long sequenceNumber) {
        removeFirst(sessionId, entry -> entry.sequenceNumber() == sequenceNumber);
    }

    @Override
    public void remove(String sessionId, long sequenceNumber, Instant scheduledTime) {
        ScheduledEntry exact = new ScheduledEntry(sequenceNumber, Objects.requireNonNull(scheduledTime, "scheduledTime"));
        removeFirst(sessionId, exact::equals);
    }

    private void removeFirst(String sessionId, Predicate<ScheduledEntry> match) {
        atomically(sessionId, () -> {
            List<ScheduledEntry> entries = sessions.get(sessionId);
            if (entries == null) {
                return null;
            }
            Iterator<ScheduledEntry> it = entries.iterator();
            while (it.hasNext()) {
                if (match.test(it.next())) {
                    it.remove();
                    break;
                }
            }
            if (entries.isEmpty()) {
                sessions.remove(sessionId);
            }
            return null;
        });
    }

    @Override
    public void clear(String sessionId) {
        atomically(sessionId, () -> sessions.remove(sessionId));
    }

    @Override
    public <V> V atomically(String sessionId, Supplier<V> action) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(action, "action");
        ReentrantLock lock = stripes[Math.floorMod(sessionId.hashCode(), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of sessions with at least one pending entry.
     */
    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Returns the number of pending entries of a session, 0 if it has none.
     */
    public int entryCount(String sessionId) {
        return atomically(sessionId, () -> {
            List<ScheduledEntry> entries = sessions.get(sessionId);
            return entries == null ? 0 : entries.size();
        });
    }

    /**
     * Returns a copy of a session's pending entries in insertion order.
     */
    public List<ScheduledEntry> entries(String sessionId) {
        return atomically(sessionId, () -> {
            List<ScheduledEntry> entries = sessions.get(sessionId);
            return entries == null ? List.of() : List.copyOf(entries);
        });
    }
}
