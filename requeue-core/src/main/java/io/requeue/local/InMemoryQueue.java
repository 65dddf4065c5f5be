package io.requeue.local;

import com.github.f4b6a3.ulid.UlidCreator;
import io.requeue.spi.MessagePublisher;
import io.requeue.spi.ScheduledMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Process-local queue with scheduled delivery, per-message time-to-live and a dead-letter list.
 *
 * <p>It mirrors the broker features the retry engine relies on: every enqueued message gets a
 * ULID message id and an increasing sequence number; scheduled messages stay invisible until
 * their time; a message whose time-to-live elapses before delivery is dead-lettered with reason
 * {@link DeadLetter#EXPIRED}. Time-to-live counts from the moment a message becomes visible:
 * enqueue for immediate messages, the scheduled time for scheduled ones.
 *
 * <p>As a {@link MessagePublisher} it can be handed straight to a {@code RetryOrchestrator}, with
 * a {@link LocalQueueConsumer} playing the host runtime.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryQueue implements MessagePublisher {
    private static final Logger logger = Logger.getLogger(InMemoryQueue.class.getName());

    private static final Comparator<QueuedMessage> DELIVERY_ORDER = Comparator
            .comparing(QueuedMessage::scheduledTime)
            .thenComparingLong(QueuedMessage::sequenceNumber);
    private static final Duration MAX_WAIT = Duration.ofHours(1);

    private final String name;
    private final Clock clock;
    private final Duration defaultTimeToLive;
    private final PriorityQueue<QueuedMessage> pending = new PriorityQueue<>(DELIVERY_ORDER);
    private final List<DeadLetter> deadLetters = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    /**
     * Creates a queue on the system clock with no default time-to-live.
     */
    public InMemoryQueue(String name) {
        this(name, Clock.systemUTC(), null);
    }

    /**
     * @param name              queue name, used in logs
     * @param clock             time source for scheduling and expiry
     * @param defaultTimeToLive applied to messages sent without one, or null for unlimited
     */
    public InMemoryQueue(String name, Clock clock, Duration defaultTimeToLive) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (defaultTimeToLive != null && (defaultTimeToLive.isZero() || defaultTimeToLive.isNegative())) {
            throw new IllegalArgumentException("defaultTimeToLive must be positive, got: " + defaultTimeToLive);
        }
        this.defaultTimeToLive = defaultTimeToLive;
    }

    public String name() {
        return name;
    }

    /**
     * Enqueues a message for immediate delivery.
     *
     * @param body message body
     * @return the enqueued message
     */
    public QueuedMessage send(String body) {
        return send(body, null);
    }

    /**
     * Enqueues a session message for immediate delivery.
     *
     * @param body      message body
     * @param sessionId session id, or null
     * @return the enqueued message
     */
    public QueuedMessage send(String body, String sessionId) {
        return enqueue(body, ScheduledMessage.APPLICATION_JSON, clock.instant(), sessionId, null);
    }

    @Override
    public void scheduleMessage(ScheduledMessage message) {
        Objects.requireNonNull(message, "message");
        enqueue(message.body(), message.contentType(), message.scheduledTime(),
                message.sessionId(), message.timeToLive());
    }

    private QueuedMessage enqueue(String body, String contentType, Instant scheduledTime,
                                  String sessionId, Duration timeToLive) {
        Instant now = clock.instant();
        Duration ttl = timeToLive != null ? timeToLive : defaultTimeToLive;
        Instant visibleAt = scheduledTime.isAfter(now) ? scheduledTime : now;
        lock.lock();
        try {
            QueuedMessage message = new QueuedMessage(
                    UlidCreator.getMonotonicUlid().toString(),
                    sequence.incrementAndGet(),
                    body,
                    contentType,
                    now,
                    scheduledTime,
                    ttl == null ? null : visibleAt.plus(ttl),
                    sessionId);
            pending.add(message);
            changed.signalAll();
            logger.fine(() -> "Enqueued " + message.messageId() + " on " + name + " for " + scheduledTime);
            return message;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next due message, waiting up to the timeout for one to become due.
     *
     * <p>Messages whose time-to-live elapsed are dead-lettered on the way.
     *
     * @param timeout how long to wait
     * @param unit    unit of {@code timeout}
     * @return the message, or empty if none became due in time
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<QueuedMessage> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (true) {
                QueuedMessage head = pending.peek();
                long untilDue = Long.MAX_VALUE;
                if (head != null) {
                    Instant now = clock.instant();
                    if (head.expiresAt() != null && !head.expiresAt().isAfter(now)) {
                        pending.poll();
                        deadLetters.add(new DeadLetter(head, DeadLetter.EXPIRED, "Time-to-live elapsed", now));
                        logger.info("Message " + head.messageId() + " on " + name + " expired before delivery");
                        continue;
                    }
                    Duration wait = Duration.between(now, head.scheduledTime());
                    if (wait.isZero() || wait.isNegative()) {
                        return Optional.of(pending.poll());
                    }
                    untilDue = wait.compareTo(MAX_WAIT) > 0 ? MAX_WAIT.toNanos() : wait.toNanos();
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                changed.awaitNanos(Math.min(remaining, untilDue));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a delivered message to the dead-letter list.
     */
    public void deadLetter(QueuedMessage message, String reason, String description) {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            deadLetters.add(new DeadLetter(message, reason, description, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the dead-letter list.
     */
    public List<DeadLetter> deadLetters() {
        lock.lock();
        try {
            return List.copyOf(deadLetters);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the messages not yet delivered, in delivery order.
     */
    public List<QueuedMessage> pendingMessages() {
        lock.lock();
        try {
            List<QueuedMessage> snapshot = new ArrayList<>(pending);
            snapshot.sort(DELIVERY_ORDER);
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of messages not yet delivered, scheduled ones included.
     */
    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }
}
