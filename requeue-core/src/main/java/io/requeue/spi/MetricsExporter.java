package io.requeue.spi;

/**
 * Observability hook for exporting retry-engine counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge
 * into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of handler invocations that completed normally.
     */
    void incrementSucceeded();

    /**
     * Increments the count of failed deliveries re-published for another attempt.
     */
    void incrementRetryScheduled();

    /**
     * Increments the count of deliveries re-published unchanged to keep session order.
     */
    void incrementDeferred();

    /**
     * Increments the count of deliveries that failed with no retries left.
     */
    void incrementExhausted();

    /**
     * Increments the count of deliveries whose deadline passed before a retry could be scheduled
     * (or at arrival, under {@code MessageExpiryStrategy.REJECT}).
     */
    void incrementExpired();

    /**
     * Increments the count of expired deliveries dropped under {@code MessageExpiryStrategy.IGNORE}.
     */
    default void incrementIgnored() {
    }

    /**
     * Records the time spent inside the user handler.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Records the delay applied to a scheduled retry, after ordering adjustments.
     *
     * @param delayMs delay in milliseconds (always non-negative)
     */
    default void recordRetryDelayMs(long delayMs) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSucceeded() {
        }

        @Override
        public void incrementRetryScheduled() {
        }

        @Override
        public void incrementDeferred() {
        }

        @Override
        public void incrementExhausted() {
        }

        @Override
        public void incrementExpired() {
        }
    }
}
