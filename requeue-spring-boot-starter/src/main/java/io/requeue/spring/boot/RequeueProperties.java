package io.requeue.spring.boot;

import io.requeue.MessageExpiryStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the retry engine.
 *
 * @see RequeueAutoConfiguration
 */
@ConfigurationProperties(prefix = "requeue")
public class RequeueProperties {

    private final Retry retry = new Retry();
    private final SessionStore sessionStore = new SessionStore();
    private final Metrics metrics = new Metrics();

    public Retry getRetry() {
        return retry;
    }

    public SessionStore getSessionStore() {
        return sessionStore;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        /**
         * Retries after the first delivery.
         */
        private int maxRetries = 3;

        /**
         * Backoff strategy name: fixed, linear or exponential.
         */
        private String strategy = "fixed";

        private Duration baseDelay = Duration.ofSeconds(1);

        /**
         * Cap for exponential delays. Unbounded when unset.
         */
        private Duration maxDelay;

        private double exponentialFactor = 2.0;

        /**
         * Step for linear backoff. Defaults to the base delay when unset.
         */
        private Duration linearIncrement;

        private double jitterFraction = 0.0;
        private boolean preserveExpiry = true;
        private boolean preserveSessionOrdering = false;
        private Duration sessionOrderingIncrement = Duration.ofSeconds(1);
        private MessageExpiryStrategy expiryStrategy = MessageExpiryStrategy.HANDLE;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getExponentialFactor() {
            return exponentialFactor;
        }

        public void setExponentialFactor(double exponentialFactor) {
            this.exponentialFactor = exponentialFactor;
        }

        public Duration getLinearIncrement() {
            return linearIncrement;
        }

        public void setLinearIncrement(Duration linearIncrement) {
            this.linearIncrement = linearIncrement;
        }

        public double getJitterFraction() {
            return jitterFraction;
        }

        public void setJitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
        }

        public boolean isPreserveExpiry() {
            return preserveExpiry;
        }

        public void setPreserveExpiry(boolean preserveExpiry) {
            this.preserveExpiry = preserveExpiry;
        }

        public boolean isPreserveSessionOrdering() {
            return preserveSessionOrdering;
        }

        public void setPreserveSessionOrdering(boolean preserveSessionOrdering) {
            this.preserveSessionOrdering = preserveSessionOrdering;
        }

        public Duration getSessionOrderingIncrement() {
            return sessionOrderingIncrement;
        }

        public void setSessionOrderingIncrement(Duration sessionOrderingIncrement) {
            this.sessionOrderingIncrement = sessionOrderingIncrement;
        }

        public MessageExpiryStrategy getExpiryStrategy() {
            return expiryStrategy;
        }

        public void setExpiryStrategy(MessageExpiryStrategy expiryStrategy) {
            this.expiryStrategy = expiryStrategy;
        }
    }

    public static class SessionStore {
        /**
         * Lock stripes guarding the in-memory session ordering store.
         */
        private int lockStripes = 64;

        public int getLockStripes() {
            return lockStripes;
        }

        public void setLockStripes(int lockStripes) {
            this.lockStripes = lockStripes;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "requeue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
