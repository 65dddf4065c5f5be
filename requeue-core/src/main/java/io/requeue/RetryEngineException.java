package io.requeue;

/**
 * Base of the exceptions the engine itself raises.
 *
 * <p>Handler exceptions never surface as-is. Only these escape an invocation, so that the
 * host runtime's own redelivery or dead-letter path takes over.
 */
public abstract sealed class RetryEngineException extends RuntimeException
        permits UnknownStrategyException, MessageExpiredException, MaxRetriesReachedException {

    RetryEngineException(String message) {
        super(message);
    }

    RetryEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
