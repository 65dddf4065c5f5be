package io.requeue.backoff;

import io.requeue.RetryConfiguration;
import io.requeue.UnknownStrategyException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the delay before a retry from a {@link RetryConfiguration} and a zero-based attempt
 * index.
 *
 * <ul>
 *   <li>{@code FIXED}: {@code baseDelay}</li>
 *   <li>{@code LINEAR}: {@code baseDelay + linearIncrement * index}</li>
 *   <li>{@code EXPONENTIAL}: {@code baseDelay * exponentialFactor^index}, capped at
 *       {@code maxDelay} when set</li>
 * </ul>
 *
 * <p>With a positive {@code jitterFraction j}, a uniform offset in {@code [-d*j, +d*j]} is then
 * added. The result is rounded to the millisecond and never negative. Arithmetic saturates
 * instead of overflowing.
 *
 * <p>This class is stateless apart from its random source and is thread-safe.
 */
public final class BackoffCalculator {
    private static final double MAX_MILLIS = Long.MAX_VALUE;

    private final DoubleSupplier random;

    /**
     * Creates a calculator drawing jitter from {@link ThreadLocalRandom}.
     */
    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a calculator with a custom random source.
     *
     * @param random supplier of uniform values in {@code [0, 1)}
     */
    public BackoffCalculator(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Computes the delay for an attempt.
     *
     * @param config        retry settings
     * @param attemptIndex  zero-based index; {@code publishCount - 1} of the delivery that failed
     * @return the delay, never negative
     * @throws UnknownStrategyException if the configured strategy is not supported
     */
    public Duration computeDelay(RetryConfiguration config, int attemptIndex) {
        Objects.requireNonNull(config, "config");
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, got: " + attemptIndex);
        }
        if (config.strategy() == null) {
            throw new UnknownStrategyException(null);
        }
        double baseMs = config.baseDelay().toMillis();
        double delayMs;
        switch (config.strategy()) {
            case FIXED:
                delayMs = baseMs;
                break;
            case LINEAR:
                delayMs = baseMs + (double) config.linearIncrement().toMillis() * attemptIndex;
                break;
            case EXPONENTIAL:
                delayMs = baseMs * Math.pow(config.exponentialFactor(), attemptIndex);
                if (config.maxDelay().isPresent()) {
                    delayMs = Math.min(delayMs, config.maxDelay().get().toMillis());
                }
                break;
            default:
                throw new UnknownStrategyException(config.strategy().name());
        }

        double jitter = config.jitterFraction();
        if (jitter > 0 && Double.isFinite(delayMs)) {
            delayMs += delayMs * jitter * (random.getAsDouble() * 2 - 1);
        }
        return Duration.ofMillis(toMillis(delayMs));
    }

    private static long toMillis(double delayMs) {
        if (Double.isNaN(delayMs) || delayMs <= 0) {
            return 0L;
        }
        if (delayMs >= MAX_MILLIS) {
            // Duration.ofMillis(Long.MAX_VALUE) is representable; saturate there
            return Long.MAX_VALUE;
        }
        return Math.round(delayMs);
    }
}
