package io.requeue;

import java.util.Locale;

/**
 * How the delay before a retry grows with the attempt index.
 *
 * @see io.requeue.backoff.BackoffCalculator
 */
public enum BackoffStrategy {
    /** Every retry waits {@code baseDelay}. */
    FIXED,
    /** Retry {@code i} waits {@code baseDelay + linearIncrement * i}. */
    LINEAR,
    /** Retry {@code i} waits {@code baseDelay * exponentialFactor^i}, capped at {@code maxDelay}. */
    EXPONENTIAL;

    /**
     * Parses a strategy name case-insensitively ({@code "fixed"}, {@code "Linear"}, ...).
     *
     * @param name the strategy name
     * @return the matching strategy
     * @throws UnknownStrategyException if {@code name} is null or not a known strategy
     */
    public static BackoffStrategy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (BackoffStrategy strategy : values()) {
                if (strategy.name().equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new UnknownStrategyException(name);
    }
}
