package io.requeue;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable retry settings for one message stream.
 *
 * <p>Create instances via {@link #builder()}. Only {@code baseDelay} is required; everything
 * else has a default documented on the corresponding builder method.
 *
 * @see io.requeue.backoff.BackoffCalculator
 * @see io.requeue.expiry.ExpiryGuard
 */
public final class RetryConfiguration {
    private final int maxRetries;
    private final BackoffStrategy strategy;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double exponentialFactor;
    private final Duration linearIncrement;
    private final double jitterFraction;
    private final boolean preserveExpiry;
    private final boolean preserveSessionOrdering;
    private final Duration sessionOrderingIncrement;
    private final MessageExpiryStrategy expiryStrategy;

    private RetryConfiguration(Builder builder) {
        if (builder.strategy == null) {
            throw new UnknownStrategyException(null);
        }
        this.strategy = builder.strategy;
        this.baseDelay = Objects.requireNonNull(builder.baseDelay, "baseDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0, got: " + baseDelay);
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
        }
        this.maxRetries = builder.maxRetries;
        if (builder.maxDelay != null && builder.maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be >= 0, got: " + builder.maxDelay);
        }
        this.maxDelay = builder.maxDelay;
        if (!(builder.exponentialFactor > 0) || Double.isInfinite(builder.exponentialFactor)) {
            throw new IllegalArgumentException("exponentialFactor must be a positive finite number, got: "
                    + builder.exponentialFactor);
        }
        this.exponentialFactor = builder.exponentialFactor;
        this.linearIncrement = builder.linearIncrement == null ? baseDelay : builder.linearIncrement;
        if (!(builder.jitterFraction >= 0.0 && builder.jitterFraction <= 1.0)) {
            throw new IllegalArgumentException("jitterFraction must be in [0, 1], got: " + builder.jitterFraction);
        }
        this.jitterFraction = builder.jitterFraction;
        this.preserveExpiry = builder.preserveExpiry;
        this.preserveSessionOrdering = builder.preserveSessionOrdering;
        this.sessionOrderingIncrement = Objects.requireNonNull(
                builder.sessionOrderingIncrement, "sessionOrderingIncrement");
        if (sessionOrderingIncrement.isNegative()) {
            throw new IllegalArgumentException("sessionOrderingIncrement must be >= 0, got: "
                    + sessionOrderingIncrement);
        }
        this.expiryStrategy = Objects.requireNonNull(builder.expiryStrategy, "expiryStrategy");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxRetries(maxRetries)
                .strategy(strategy)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .exponentialFactor(exponentialFactor)
                .linearIncrement(linearIncrement)
                .jitterFraction(jitterFraction)
                .preserveExpiry(preserveExpiry)
                .preserveSessionOrdering(preserveSessionOrdering)
                .sessionOrderingIncrement(sessionOrderingIncrement)
                .expiryStrategy(expiryStrategy);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public BackoffStrategy strategy() {
        return strategy;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Optional<Duration> maxDelay() {
        return Optional.ofNullable(maxDelay);
    }

    public double exponentialFactor() {
        return exponentialFactor;
    }

    public Duration linearIncrement() {
        return linearIncrement;
    }

    public double jitterFraction() {
        return jitterFraction;
    }

    public boolean preserveExpiry() {
        return preserveExpiry;
    }

    public boolean preserveSessionOrdering() {
        return preserveSessionOrdering;
    }

    public Duration sessionOrderingIncrement() {
        return sessionOrderingIncrement;
    }

    public MessageExpiryStrategy expiryStrategy() {
        return expiryStrategy;
    }

    @Override
    public String toString() {
        return "RetryConfiguration{"
                + "maxRetries=" + maxRetries
                + ", strategy=" + strategy
                + ", baseDelay=" + baseDelay
                + ", maxDelay=" + maxDelay
                + ", exponentialFactor=" + exponentialFactor
                + ", linearIncrement=" + linearIncrement
                + ", jitterFraction=" + jitterFraction
                + ", preserveExpiry=" + preserveExpiry
                + ", preserveSessionOrdering=" + preserveSessionOrdering
                + ", sessionOrderingIncrement=" + sessionOrderingIncrement
                + ", expiryStrategy=" + expiryStrategy
                + '}';
    }

    /** Builder for {@link RetryConfiguration}. */
    public static final class Builder {
        private int maxRetries = 3;
        private BackoffStrategy strategy = BackoffStrategy.FIXED;
        private Duration baseDelay;
        private Duration maxDelay;
        private double exponentialFactor = 2.0;
        private Duration linearIncrement;
        private double jitterFraction;
        private boolean preserveExpiry = true;
        private boolean preserveSessionOrdering;
        private Duration sessionOrderingIncrement = Duration.ofMillis(1000);
        private MessageExpiryStrategy expiryStrategy = MessageExpiryStrategy.HANDLE;

        private Builder() {}

        /**
         * Sets how many retries follow the first delivery. A message is delivered at most
         * {@code maxRetries + 1} times.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
         *
         * @param maxRetries retry budget
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the backoff strategy.
         *
         * <p>Optional. Defaults to {@link BackoffStrategy#FIXED}.
         *
         * @param strategy the strategy
         * @return this builder
         */
        public Builder strategy(BackoffStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        /**
         * Sets the backoff strategy by name, as found in configuration files.
         *
         * @param strategyName case-insensitive strategy name
         * @return this builder
         * @throws UnknownStrategyException if the name is not a known strategy
         */
        public Builder strategy(String strategyName) {
            this.strategy = BackoffStrategy.fromName(strategyName);
            return this;
        }

        /**
         * Sets the delay before the first retry, and the unit every strategy scales.
         *
         * <p><b>Required.</b> Must not be negative.
         *
         * @param baseDelay base delay
         * @return this builder
         */
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        /**
         * Caps the exponential delay.
         *
         * <p>Optional. Unbounded when unset.
         *
         * @param maxDelay upper bound for exponential delays, or null
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Sets the multiplier applied per attempt by {@link BackoffStrategy#EXPONENTIAL}.
         *
         * <p>Optional. Defaults to {@code 2.0}.
         *
         * @param exponentialFactor growth factor
         * @return this builder
         */
        public Builder exponentialFactor(double exponentialFactor) {
            this.exponentialFactor = exponentialFactor;
            return this;
        }

        /**
         * Sets the step added per attempt by {@link BackoffStrategy#LINEAR}.
         *
         * <p>Optional. Defaults to {@code baseDelay}. May be negative; the computed delay is
         * floored at zero.
         *
         * @param linearIncrement linear step, or null for the default
         * @return this builder
         */
        public Builder linearIncrement(Duration linearIncrement) {
            this.linearIncrement = linearIncrement;
            return this;
        }

        /**
         * Sets the relative jitter applied to each computed delay.
         *
         * <p>Optional. Defaults to {@code 0} (no jitter). Must be within {@code [0, 1]}.
         *
         * @param jitterFraction jitter fraction
         * @return this builder
         */
        public Builder jitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
            return this;
        }

        /**
         * Controls whether retries carry the remaining lifetime of the original message.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param preserveExpiry whether to preserve the original deadline
         * @return this builder
         */
        public Builder preserveExpiry(boolean preserveExpiry) {
            this.preserveExpiry = preserveExpiry;
            return this;
        }

        /**
         * Controls whether retries within a session are kept in sequence-number order.
         *
         * <p>Optional. Defaults to {@code false}.
         *
         * @param preserveSessionOrdering whether to coordinate retries per session
         * @return this builder
         */
        public Builder preserveSessionOrdering(boolean preserveSessionOrdering) {
            this.preserveSessionOrdering = preserveSessionOrdering;
            return this;
        }

        /**
         * Sets the gap kept between a lower sequence's scheduled retry and a higher one pushed
         * behind it.
         *
         * <p>Optional. Defaults to {@code 1000ms}. Must not be negative.
         *
         * @param sessionOrderingIncrement ordering gap
         * @return this builder
         */
        public Builder sessionOrderingIncrement(Duration sessionOrderingIncrement) {
            this.sessionOrderingIncrement = sessionOrderingIncrement;
            return this;
        }

        /**
         * Sets what happens to a delivery that arrives after its original deadline.
         *
         * <p>Optional. Defaults to {@link MessageExpiryStrategy#HANDLE}.
         *
         * @param expiryStrategy arrival-time expiry handling
         * @return this builder
         */
        public Builder expiryStrategy(MessageExpiryStrategy expiryStrategy) {
            this.expiryStrategy = expiryStrategy;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws NullPointerException     if {@code baseDelay} is unset
         * @throws IllegalArgumentException if a value is out of range
         * @throws UnknownStrategyException if the strategy was set to null
         */
        public RetryConfiguration build() {
            return new RetryConfiguration(this);
        }
    }
}
