package io.requeue.spring.boot;

import io.requeue.MessageExpiryStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequeuePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(RequeueProperties.class);
            assertEquals(3, props.getRetry().getMaxRetries());
            assertEquals("fixed", props.getRetry().getStrategy());
            assertEquals(Duration.ofSeconds(1), props.getRetry().getBaseDelay());
            assertNull(props.getRetry().getMaxDelay());
            assertEquals(2.0, props.getRetry().getExponentialFactor());
            assertNull(props.getRetry().getLinearIncrement());
            assertEquals(0.0, props.getRetry().getJitterFraction());
            assertTrue(props.getRetry().isPreserveExpiry());
            assertFalse(props.getRetry().isPreserveSessionOrdering());
            assertEquals(Duration.ofSeconds(1), props.getRetry().getSessionOrderingIncrement());
            assertEquals(MessageExpiryStrategy.HANDLE, props.getRetry().getExpiryStrategy());
            assertEquals(64, props.getSessionStore().getLockStripes());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("requeue", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "requeue.retry.linear-increment=PT3S",
                "requeue.retry.expiry-strategy=IGNORE",
                "requeue.session-store.lock-stripes=16",
                "requeue.metrics.enabled=false",
                "requeue.metrics.name-prefix=my.requeue"
        ).run(ctx -> {
            var props = ctx.getBean(RequeueProperties.class);
            assertEquals(Duration.ofSeconds(3), props.getRetry().getLinearIncrement());
            assertEquals(MessageExpiryStrategy.IGNORE, props.getRetry().getExpiryStrategy());
            assertEquals(16, props.getSessionStore().getLockStripes());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("my.requeue", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(RequeueProperties.class)
    static class PropsConfig {
    }
}
