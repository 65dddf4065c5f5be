package io.requeue;

import io.requeue.backoff.BackoffCalculator;
import io.requeue.codec.EnvelopeCodec;
import io.requeue.session.InMemorySessionOrderingStore;
import io.requeue.session.SessionOrderingStore;
import io.requeue.spi.MessagePublisher;
import io.requeue.spi.MetricsExporter;

import java.time.Clock;
import java.util.Objects;

/**
 * Holds the components shared by every message stream of an application and creates one
 * {@link RetryOrchestrator} per stream.
 *
 * <p>All orchestrators created by one engine share its {@link SessionOrderingStore}, so retries of
 * a session stay ordered even when several streams consume it.
 *
 * <pre>{@code
 * RetryEngine engine = RetryEngine.builder()
 *     .defaultConfiguration(RetryConfiguration.builder().baseDelay(Duration.ofSeconds(5)).build())
 *     .build();
 * RetryOrchestrator<Order, Void> orders = engine.orchestrator(Order.class, ordersPublisher,
 *     (order, ctx) -> { fulfil(order); return null; });
 * }</pre>
 */
public final class RetryEngine {
    private final RetryConfiguration defaultConfiguration;
    private final SessionOrderingStore sessionStore;
    private final EnvelopeCodec codec;
    private final BackoffCalculator backoff;
    private final MetricsExporter metrics;
    private final Clock clock;

    private RetryEngine(Builder builder) {
        this.defaultConfiguration = Objects.requireNonNull(builder.defaultConfiguration, "defaultConfiguration");
        this.sessionStore = builder.sessionStore != null ? builder.sessionStore : new InMemorySessionOrderingStore();
        this.codec = builder.codec != null ? builder.codec : EnvelopeCodec.getDefault();
        this.backoff = builder.backoff != null ? builder.backoff : new BackoffCalculator();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an orchestrator using the engine's default configuration.
     */
    public <T, R> RetryOrchestrator<T, R> orchestrator(Class<T> payloadType, MessagePublisher publisher,
                                                       RetryHandler<T, R> handler) {
        return orchestrator(payloadType, defaultConfiguration, publisher, handler);
    }

    /**
     * Creates an orchestrator with stream-specific retry settings.
     *
     * @param payloadType   payload type the body is bound to
     * @param configuration retry settings for this stream
     * @param publisher     publisher for this stream's destination
     * @param handler       the user handler
     * @return the orchestrator
     */
    public <T, R> RetryOrchestrator<T, R> orchestrator(Class<T> payloadType, RetryConfiguration configuration,
                                                       MessagePublisher publisher, RetryHandler<T, R> handler) {
        return RetryOrchestrator.builder(payloadType)
                .configuration(configuration)
                .publisher(publisher)
                .sessionStore(sessionStore)
                .codec(codec)
                .backoff(backoff)
                .metrics(metrics)
                .clock(clock)
                .build(handler);
    }

    public RetryConfiguration defaultConfiguration() {
        return defaultConfiguration;
    }

    public SessionOrderingStore sessionStore() {
        return sessionStore;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    /** Builder for {@link RetryEngine}. */
    public static final class Builder {
        private RetryConfiguration defaultConfiguration;
        private SessionOrderingStore sessionStore;
        private EnvelopeCodec codec;
        private BackoffCalculator backoff;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {}

        /**
         * Sets the retry settings used by {@link #orchestrator(Class, MessagePublisher, RetryHandler)}.
         *
         * <p><b>Required.</b>
         *
         * @param defaultConfiguration default retry settings
         * @return this builder
         */
        public Builder defaultConfiguration(RetryConfiguration defaultConfiguration) {
            this.defaultConfiguration = defaultConfiguration;
            return this;
        }

        /**
         * <p>Optional. Defaults to a new {@link InMemorySessionOrderingStore}.
         *
         * @param sessionStore the shared session ordering store
         * @return this builder
         */
        public Builder sessionStore(SessionOrderingStore sessionStore) {
            this.sessionStore = sessionStore;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link EnvelopeCodec#getDefault()}.
         *
         * @param codec the envelope codec
         * @return this builder
         */
        public Builder codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder backoff(BackoffCalculator backoff) {
            this.backoff = backoff;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RetryEngine build() {
            return new RetryEngine(this);
        }
    }
}
