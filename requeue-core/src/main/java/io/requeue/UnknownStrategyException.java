package io.requeue;

/**
 * Thrown when a backoff strategy name or value is not recognised.
 *
 * <p>This is a configuration error. It is never retried.
 */
public final class UnknownStrategyException extends RetryEngineException {

    private final String strategyName;

    public UnknownStrategyException(String strategyName) {
        super("Unknown backoff strategy: " + strategyName);
        this.strategyName = strategyName;
    }

    /**
     * Returns the rejected strategy name, or null when no strategy was given.
     */
    public String strategyName() {
        return strategyName;
    }
}
