package io.requeue;

import io.requeue.backoff.BackoffCalculator;
import io.requeue.codec.EnvelopeCodec;
import io.requeue.expiry.ExpiryDecision;
import io.requeue.expiry.ExpiryGuard;
import io.requeue.session.InMemorySessionOrderingStore;
import io.requeue.session.SessionOrderingStore;
import io.requeue.spi.MessagePublisher;
import io.requeue.spi.MetricsExporter;
import io.requeue.spi.ScheduledMessage;

import java.lang.reflect.Type;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link RetryHandler} for one delivery and turns failures into scheduled retries.
 *
 * <p>For each {@link InboundMessage} the orchestrator:
 * <ol>
 *   <li>decodes the body into a first delivery or a retry envelope;</li>
 *   <li>applies the arrival {@link MessageExpiryStrategy} when the message is already past its
 *       original deadline;</li>
 *   <li>with session ordering enabled, defers the delivery behind a pending lower sequence
 *       number of the same session, without running the handler;</li>
 *   <li>runs the handler;</li>
 *   <li>on failure either gives up ({@code publishCount > maxRetries}) or publishes the next
 *       envelope, delayed by the configured backoff, pushed behind pending lower sequence numbers
 *       and bounded by the original deadline.</li>
 * </ol>
 *
 * <p>Backoff is never slept: the retry is handed to the {@link MessagePublisher} with a scheduled
 * time and the calling thread returns immediately. Each session's read-decide-write sequence runs
 * inside {@link SessionOrderingStore#atomically}; publishing happens outside the lock.
 *
 * <p>Create instances via {@link #builder(Class)}. This class is thread-safe; the host runtime
 * may invoke it concurrently.
 *
 * @param <T> payload type
 * @param <R> handler result type
 * @see RetryEngine
 */
public final class RetryOrchestrator<T, R> {
    private static final Logger logger = Logger.getLogger(RetryOrchestrator.class.getName());

    private final Type payloadType;
    private final RetryHandler<T, R> handler;
    private final RetryConfiguration config;
    private final MessagePublisher publisher;
    private final SessionOrderingStore sessionStore;
    private final EnvelopeCodec codec;
    private final BackoffCalculator backoff;
    private final ExpiryGuard expiryGuard;
    private final MetricsExporter metrics;
    private final Clock clock;

    private RetryOrchestrator(Builder<T> builder, RetryHandler<T, R> handler) {
        this.payloadType = builder.payloadType;
        this.handler = Objects.requireNonNull(handler, "handler");
        this.config = Objects.requireNonNull(builder.config, "config");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        this.sessionStore = builder.sessionStore != null
                ? builder.sessionStore : new InMemorySessionOrderingStore();
        this.codec = builder.codec != null ? builder.codec : EnvelopeCodec.getDefault();
        this.backoff = builder.backoff != null ? builder.backoff : new BackoffCalculator();
        this.expiryGuard = new ExpiryGuard();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    /**
     * Creates a builder for payloads of the given type.
     *
     * @param payloadType payload type the body is bound to
     * @param <T>         payload type
     * @return a new builder
     */
    public static <T> Builder<T> builder(Class<T> payloadType) {
        return new Builder<>(Objects.requireNonNull(payloadType, "payloadType"));
    }

    public RetryConfiguration configuration() {
        return config;
    }

    public SessionOrderingStore sessionStore() {
        return sessionStore;
    }

    /**
     * Processes a delivery and reports what happened.
     *
     * <p>Anything the handler throws, errors included, stays inside this method and becomes a
     * {@link RetryOutcome.Rescheduled}, {@link RetryOutcome.Exhausted} or
     * {@link RetryOutcome.Expired}. Only a {@link VirtualMachineError} propagates.
     *
     * @param message the delivery
     * @return the outcome
     * @throws io.requeue.codec.EnvelopeFormatException if the body cannot be decoded
     * @throws MessagePublishException                  if a retry or deferral could not be published
     */
    public RetryOutcome<R> process(InboundMessage message) {
        Objects.requireNonNull(message, "message");
        Delivery<T> delivery = codec.decode(message.body(), payloadType);
        RetryEnvelope<T> envelope = delivery.toEnvelope(message.metadata());
        OriginalBindingData binding = envelope.originalBindingData();
        String currentId = message.metadata().messageId();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine((delivery instanceof Delivery.RetryDelivery ? "Restored retry envelope" : "First delivery")
                    + " for originalId=" + binding.messageId() + ", currentId=" + currentId
                    + ", publishCount=" + envelope.publishCount());
        }

        boolean ordered = orderingActive(binding);

        if (config.expiryStrategy() != MessageExpiryStrategy.HANDLE
                && expiryGuard.isExpired(binding, clock.instant())) {
            return onExpiredArrival(binding, currentId, ordered);
        }

        if (ordered) {
            Optional<RetryOutcome<R>> deferred = deferIfBehind(envelope, currentId);
            if (deferred.isPresent()) {
                return deferred.get();
            }
        }

        RetryContext context = new RetryContext(
                binding, envelope.publishCount(), message.metadata(), message.hostContext());
        long startNanos = System.nanoTime();
        R result;
        try {
            result = handler.handle(envelope.payload(), context);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            metrics.recordHandlerDurationMs(elapsedMs(startNanos));
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return onFailure(envelope, currentId, ordered, t);
        }
        metrics.recordHandlerDurationMs(elapsedMs(startNanos));

        if (ordered) {
            sessionStore.remove(binding.sessionId(), binding.sequenceNumber());
        }
        metrics.incrementSucceeded();
        return new RetryOutcome.Succeeded<>(result);
    }

    /**
     * Processes a delivery and returns the handler result, or throws the engine's terminal
     * exceptions so that the host runtime dead-letters the message.
     *
     * @param message the delivery
     * @return the handler result, or null if the delivery was rescheduled, deferred or ignored
     * @throws MaxRetriesReachedException if the handler failed with no retries left
     * @throws MessageExpiredException    if the message's deadline passed
     * @throws MessagePublishException    if a retry or deferral could not be published
     */
    public R execute(InboundMessage message) {
        return process(message).orThrow();
    }

    private boolean orderingActive(OriginalBindingData binding) {
        if (!config.preserveSessionOrdering()) {
            return false;
        }
        if (!binding.hasSession()) {
            logger.log(Level.WARNING, "Session ordering is enabled but message originalId="
                    + binding.messageId() + " has no session id or sequence number; ordering skipped");
            return false;
        }
        return true;
    }

    private RetryOutcome<R> onExpiredArrival(OriginalBindingData binding, String currentId, boolean ordered) {
        if (ordered) {
            sessionStore.remove(binding.sessionId(), binding.sequenceNumber());
        }
        if (config.expiryStrategy() == MessageExpiryStrategy.IGNORE) {
            logger.info("Ignoring expired message originalId=" + binding.messageId() + ", currentId=" + currentId);
            metrics.incrementIgnored();
            return new RetryOutcome.Ignored<>();
        }
        logger.info("Rejecting expired message originalId=" + binding.messageId() + ", currentId=" + currentId);
        metrics.incrementExpired();
        Instant expiresAt = expiryGuard.expiresAt(binding).orElseThrow();
        return new RetryOutcome.Expired<>(new MessageExpiredException(binding.messageId(), currentId, expiresAt));
    }

    private Optional<RetryOutcome<R>> deferIfBehind(RetryEnvelope<T> envelope, String currentId) {
        OriginalBindingData binding = envelope.originalBindingData();
        String sessionId = binding.sessionId();
        long sequenceNumber = binding.sequenceNumber();
        Optional<Instant> deferredUntil = sessionStore.atomically(sessionId, () -> {
            Optional<Instant> latest = sessionStore.latestScheduledBefore(sessionId, sequenceNumber);
            if (latest.isEmpty() || !latest.get().isAfter(clock.instant())) {
                return Optional.<Instant>empty();
            }
            Instant scheduledTime = latest.get().plus(config.sessionOrderingIncrement());
            sessionStore.add(sessionId, sequenceNumber, scheduledTime);
            return Optional.of(scheduledTime);
        });
        if (deferredUntil.isEmpty()) {
            return Optional.empty();
        }

        Instant scheduledTime = deferredUntil.get();
        // deferral is not a retry and never fails on expiry; a deadline already behind the
        // deferred time is left to the next retry or to the arrival check
        ExpiryDecision expiry = expiryGuard.apply(config, binding, scheduledTime);
        Duration timeToLive = expiry instanceof ExpiryDecision.TimeToLive ttl ? ttl.remaining() : null;
        publish(codec.encode(envelope), scheduledTime, timeToLive, binding, true);
        logger.info("Deferred message originalId=" + binding.messageId() + ", currentId=" + currentId
                + " (session " + sessionId + ", sequence " + sequenceNumber + ") until " + scheduledTime);
        metrics.incrementDeferred();
        return Optional.of(new RetryOutcome.Deferred<>(scheduledTime));
    }

    private RetryOutcome<R> onFailure(RetryEnvelope<T> envelope, String currentId, boolean ordered, Throwable failure) {
        OriginalBindingData binding = envelope.originalBindingData();
        int publishCount = envelope.publishCount();
        logger.log(Level.WARNING, "Handler failed for originalId=" + binding.messageId()
                + ", currentId=" + currentId + ", publishCount=" + publishCount, failure);

        if (publishCount > config.maxRetries()) {
            if (ordered) {
                sessionStore.remove(binding.sessionId(), binding.sequenceNumber());
            }
            logger.info("Max retries reached for originalId=" + binding.messageId()
                    + ", currentId=" + currentId + " after " + publishCount + " deliveries");
            metrics.incrementExhausted();
            return new RetryOutcome.Exhausted<>(
                    new MaxRetriesReachedException(binding.messageId(), currentId, publishCount, failure));
        }

        RetryEnvelope<T> next = envelope.next();
        String body = codec.encode(next);
        Duration delay = backoff.computeDelay(config, publishCount - 1);
        Instant now = clock.instant();
        Instant initialTime = now.plus(delay);

        Schedule schedule = ordered
                ? sessionStore.atomically(binding.sessionId(), () -> schedule(binding, initialTime, true))
                : schedule(binding, initialTime, false);

        if (schedule.expiredAt() != null) {
            logger.info("Message expired for originalId=" + binding.messageId() + ", currentId=" + currentId
                    + "; not rescheduling");
            metrics.incrementExpired();
            return new RetryOutcome.Expired<>(
                    new MessageExpiredException(binding.messageId(), currentId, schedule.expiredAt()));
        }

        publish(body, schedule.time(), schedule.timeToLive(), binding, ordered);
        long delayMs = Math.max(0L, Duration.between(now, schedule.time()).toMillis());
        logger.info("Rescheduled originalId=" + binding.messageId() + ", currentId=" + currentId
                + " as publish " + next.publishCount() + " in " + delayMs + "ms");
        metrics.incrementRetryScheduled();
        metrics.recordRetryDelayMs(delayMs);
        return new RetryOutcome.Rescheduled<>(schedule.time(), next.publishCount());
    }

    private Schedule schedule(OriginalBindingData binding, Instant initialTime, boolean ordered) {
        Instant scheduledTime = initialTime;
        if (ordered) {
            Optional<Instant> latest = sessionStore.latestScheduledBefore(
                    binding.sessionId(), binding.sequenceNumber());
            if (latest.isPresent() && !latest.get().isBefore(scheduledTime)) {
                scheduledTime = latest.get().plus(config.sessionOrderingIncrement());
            }
        }
        // the retry must still be alive when it becomes visible
        ExpiryDecision expiry = expiryGuard.apply(config, binding, scheduledTime);
        if (expiry instanceof ExpiryDecision.Expired expired) {
            return new Schedule(scheduledTime, null, expired.expiresAt());
        }
        Duration timeToLive = expiry instanceof ExpiryDecision.TimeToLive ttl ? ttl.remaining() : null;
        if (ordered) {
            sessionStore.add(binding.sessionId(), binding.sequenceNumber(), scheduledTime);
        }
        return new Schedule(scheduledTime, timeToLive, null);
    }

    private void publish(String body, Instant scheduledTime, Duration timeToLive,
                         OriginalBindingData binding, boolean ordered) {
        ScheduledMessage message = new ScheduledMessage(
                body, ScheduledMessage.APPLICATION_JSON, scheduledTime, binding.sessionId(), timeToLive);
        try {
            publisher.scheduleMessage(message);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (ordered) {
                sessionStore.remove(binding.sessionId(), binding.sequenceNumber(), scheduledTime);
            }
            logger.log(Level.WARNING, "Failed to publish message originalId=" + binding.messageId()
                    + " scheduled for " + scheduledTime, e);
            throw new MessagePublishException(
                    "Failed to publish message originalId=" + binding.messageId(), e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    private record Schedule(Instant time, Duration timeToLive, Instant expiredAt) {
    }

    /**
     * Builder for {@link RetryOrchestrator}.
     *
     * @param <T> payload type
     */
    public static final class Builder<T> {
        private final Type payloadType;
        private RetryConfiguration config;
        private MessagePublisher publisher;
        private SessionOrderingStore sessionStore;
        private EnvelopeCodec codec;
        private BackoffCalculator backoff;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder(Type payloadType) {
            this.payloadType = payloadType;
        }

        /**
         * Sets the retry settings of this stream.
         *
         * <p><b>Required.</b>
         *
         * @param config retry settings
         * @return this builder
         */
        public Builder<T> configuration(RetryConfiguration config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the publisher retries and deferrals are scheduled on.
         *
         * <p><b>Required.</b>
         *
         * @param publisher outbound publisher
         * @return this builder
         */
        public Builder<T> publisher(MessagePublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        /**
         * Sets the store coordinating retries per session. Share one store between all
         * orchestrators consuming the same sessions.
         *
         * <p>Optional. Defaults to a new {@link InMemorySessionOrderingStore}.
         *
         * @param sessionStore session ordering store
         * @return this builder
         */
        public Builder<T> sessionStore(SessionOrderingStore sessionStore) {
            this.sessionStore = sessionStore;
            return this;
        }

        /**
         * Sets the envelope codec.
         *
         * <p>Optional. Defaults to {@link EnvelopeCodec#getDefault()}.
         *
         * @param codec envelope codec
         * @return this builder
         */
        public Builder<T> codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Sets the backoff calculator, typically to fix its random source in tests.
         *
         * <p>Optional. Defaults to a {@link BackoffCalculator} using {@code ThreadLocalRandom}.
         *
         * @param backoff backoff calculator
         * @return this builder
         */
        public Builder<T> backoff(BackoffCalculator backoff) {
            this.backoff = backoff;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics metrics exporter
         * @return this builder
         */
        public Builder<T> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used for scheduling and expiry.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock time source
         * @return this builder
         */
        public Builder<T> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds an orchestrator around a handler.
         *
         * @param handler the user handler
         * @param <R>     handler result type
         * @return the orchestrator
         * @throws NullPointerException if a required component is missing
         */
        public <R> RetryOrchestrator<T, R> build(RetryHandler<T, R> handler) {
            return new RetryOrchestrator<>(this, handler);
        }
    }
}
