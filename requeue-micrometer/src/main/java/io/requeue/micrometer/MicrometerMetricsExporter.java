package io.requeue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.requeue.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code requeue.handler.success}: handler invocations that completed normally</li>
 *   <li>{@code requeue.retry.scheduled}: failed deliveries re-published for another attempt</li>
 *   <li>{@code requeue.ordering.deferred}: deliveries re-published unchanged to keep session order</li>
 *   <li>{@code requeue.retry.exhausted}: deliveries that failed with no retries left</li>
 *   <li>{@code requeue.retry.expired}: deliveries whose deadline passed</li>
 *   <li>{@code requeue.expired.ignored}: expired deliveries dropped without error</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code requeue.handler.duration.ms}: time spent in the handler</li>
 *   <li>{@code requeue.retry.delay.ms}: delay applied to scheduled retries</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_NAME_PREFIX = "requeue";

    private final MeterRegistry registry;
    private final Counter succeeded;
    private final Counter retryScheduled;
    private final Counter deferred;
    private final Counter exhausted;
    private final Counter expired;
    private final Counter ignored;
    private final DistributionSummary handlerDuration;
    private final DistributionSummary retryDelay;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "requeue"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_NAME_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix, for several engines sharing a registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.requeue"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.succeeded = counter(namePrefix + ".handler.success", "Handler invocations that completed normally");
        this.retryScheduled = counter(namePrefix + ".retry.scheduled", "Failed deliveries scheduled for retry");
        this.deferred = counter(namePrefix + ".ordering.deferred", "Deliveries deferred behind a session retry");
        this.exhausted = counter(namePrefix + ".retry.exhausted", "Deliveries that failed with no retries left");
        this.expired = counter(namePrefix + ".retry.expired", "Deliveries whose deadline passed");
        this.ignored = counter(namePrefix + ".expired.ignored", "Expired deliveries dropped without error");
        this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
                .description("Time spent in the handler")
                .baseUnit("milliseconds")
                .register(registry);
        this.retryDelay = DistributionSummary.builder(namePrefix + ".retry.delay.ms")
                .description("Delay applied to scheduled retries")
                .baseUnit("milliseconds")
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    @Override
    public void incrementSucceeded() {
        if (closed) return;
        succeeded.increment();
    }

    @Override
    public void incrementRetryScheduled() {
        if (closed) return;
        retryScheduled.increment();
    }

    @Override
    public void incrementDeferred() {
        if (closed) return;
        deferred.increment();
    }

    @Override
    public void incrementExhausted() {
        if (closed) return;
        exhausted.increment();
    }

    @Override
    public void incrementExpired() {
        if (closed) return;
        expired.increment();
    }

    @Override
    public void incrementIgnored() {
        if (closed) return;
        ignored.increment();
    }

    @Override
    public void recordHandlerDurationMs(long durationMs) {
        if (closed) return;
        handlerDuration.record(durationMs);
    }

    @Override
    public void recordRetryDelayMs(long delayMs) {
        if (closed) return;
        retryDelay.record(delayMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry. Later calls record nothing.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(succeeded, retryScheduled, deferred, exhausted, expired, ignored,
                handlerDuration, retryDelay)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
