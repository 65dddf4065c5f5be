package io.requeue;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryConfigurationTest {

    @Test
    void defaults() {
        RetryConfiguration config = RetryConfiguration.builder().baseDelay(Duration.ofSeconds(5)).build();

        assertEquals(3, config.maxRetries());
        assertEquals(BackoffStrategy.FIXED, config.strategy());
        assertTrue(config.maxDelay().isEmpty());
        assertEquals(2.0, config.exponentialFactor());
        assertEquals(Duration.ofSeconds(5), config.linearIncrement());
        assertEquals(0.0, config.jitterFraction());
        assertTrue(config.preserveExpiry());
        assertFalse(config.preserveSessionOrdering());
        assertEquals(Duration.ofMillis(1000), config.sessionOrderingIncrement());
        assertEquals(MessageExpiryStrategy.HANDLE, config.expiryStrategy());
    }

    @Test
    void baseDelayRequired() {
        assertThrows(NullPointerException.class, () -> RetryConfiguration.builder().build());
    }

    @Test
    void strategyByName() {
        RetryConfiguration config = RetryConfiguration.builder()
                .strategy("exponential")
                .baseDelay(Duration.ofSeconds(1))
                .build();

        assertEquals(BackoffStrategy.EXPONENTIAL, config.strategy());
    }

    @Test
    void unknownStrategyNameRejectedImmediately() {
        assertThrows(UnknownStrategyException.class, () -> RetryConfiguration.builder().strategy("random"));
    }

    @Test
    void nullStrategyRejectedAsUnknown() {
        UnknownStrategyException ex = assertThrows(UnknownStrategyException.class, () ->
                RetryConfiguration.builder()
                        .strategy((BackoffStrategy) null)
                        .baseDelay(Duration.ofSeconds(1))
                        .build());

        assertNull(ex.strategyName());
    }

    @Test
    void rejectsNegativeMaxRetries() {
        assertThrows(IllegalArgumentException.class, () ->
                RetryConfiguration.builder().baseDelay(Duration.ofSeconds(1)).maxRetries(-1).build());
    }

    @Test
    void rejectsJitterOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () ->
                RetryConfiguration.builder().baseDelay(Duration.ofSeconds(1)).jitterFraction(1.5).build());
        assertThrows(IllegalArgumentException.class, () ->
                RetryConfiguration.builder().baseDelay(Duration.ofSeconds(1)).jitterFraction(-0.1).build());
        assertThrows(IllegalArgumentException.class, () ->
                RetryConfiguration.builder().baseDelay(Duration.ofSeconds(1)).jitterFraction(Double.NaN).build());
    }

    @Test
    void rejectsNonPositiveFactor() {
        assertThrows(IllegalArgumentException.class, () ->
                RetryConfiguration.builder().baseDelay(Duration.ofSeconds(1)).exponentialFactor(0).build());
    }

    @Test
    void rejectsNegativeDelays() {
        assertThrows(IllegalArgumentException.class, () ->
                RetryConfiguration.builder().baseDelay(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class, () ->
                RetryConfiguration.builder().baseDelay(Duration.ofSeconds(1)).maxDelay(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class, () ->
                RetryConfiguration.builder().baseDelay(Duration.ofSeconds(1))
                        .sessionOrderingIncrement(Duration.ofMillis(-1)).build());
    }

    @Test
    void toBuilderCopiesEverySetting() {
        RetryConfiguration original = RetryConfiguration.builder()
                .maxRetries(7)
                .strategy(BackoffStrategy.LINEAR)
                .baseDelay(Duration.ofMillis(250))
                .maxDelay(Duration.ofSeconds(30))
                .exponentialFactor(1.5)
                .linearIncrement(Duration.ofMillis(100))
                .jitterFraction(0.3)
                .preserveExpiry(false)
                .preserveSessionOrdering(true)
                .sessionOrderingIncrement(Duration.ofMillis(20))
                .expiryStrategy(MessageExpiryStrategy.IGNORE)
                .build();

        RetryConfiguration copy = original.toBuilder().build();

        assertEquals(original.toString(), copy.toString());
    }
}
