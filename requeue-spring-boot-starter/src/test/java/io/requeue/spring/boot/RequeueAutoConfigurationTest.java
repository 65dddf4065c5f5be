package io.requeue.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.requeue.BackoffStrategy;
import io.requeue.InboundMessage;
import io.requeue.MessageExpiryStrategy;
import io.requeue.RetryConfiguration;
import io.requeue.RetryEngine;
import io.requeue.RetryOrchestrator;
import io.requeue.RetryOutcome;
import io.requeue.TriggerMetadata;
import io.requeue.UnknownStrategyException;
import io.requeue.codec.EnvelopeCodec;
import io.requeue.codec.JacksonEnvelopeCodec;
import io.requeue.session.InMemorySessionOrderingStore;
import io.requeue.session.SessionOrderingStore;
import io.requeue.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequeueAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RequeueAutoConfiguration.class));

    @Test
    void defaultBeans() {
        runner.run(ctx -> {
            RetryConfiguration config = ctx.getBean(RetryConfiguration.class);
            assertEquals(3, config.maxRetries());
            assertEquals(BackoffStrategy.FIXED, config.strategy());
            assertEquals(Duration.ofSeconds(1), config.baseDelay());
            assertEquals(Optional.empty(), config.maxDelay());
            assertTrue(config.preserveExpiry());
            assertFalse(config.preserveSessionOrdering());
            assertEquals(MessageExpiryStrategy.HANDLE, config.expiryStrategy());

            assertInstanceOf(InMemorySessionOrderingStore.class, ctx.getBean(SessionOrderingStore.class));
            assertSame(EnvelopeCodec.getDefault(), ctx.getBean(EnvelopeCodec.class));

            RetryEngine engine = ctx.getBean(RetryEngine.class);
            assertSame(config, engine.defaultConfiguration());
            assertSame(ctx.getBean(SessionOrderingStore.class), engine.sessionStore());
            assertSame(MetricsExporter.NOOP, engine.metrics());
        });
    }

    @Test
    void customRetryProperties() {
        runner.withPropertyValues(
                "requeue.retry.max-retries=5",
                "requeue.retry.strategy=Exponential",
                "requeue.retry.base-delay=500ms",
                "requeue.retry.max-delay=PT30S",
                "requeue.retry.exponential-factor=3.0",
                "requeue.retry.jitter-fraction=0.25",
                "requeue.retry.preserve-expiry=false",
                "requeue.retry.preserve-session-ordering=true",
                "requeue.retry.session-ordering-increment=250ms",
                "requeue.retry.expiry-strategy=reject"
        ).run(ctx -> {
            RetryConfiguration config = ctx.getBean(RetryConfiguration.class);
            assertEquals(5, config.maxRetries());
            assertEquals(BackoffStrategy.EXPONENTIAL, config.strategy());
            assertEquals(Duration.ofMillis(500), config.baseDelay());
            assertEquals(Optional.of(Duration.ofSeconds(30)), config.maxDelay());
            assertEquals(3.0, config.exponentialFactor());
            assertEquals(0.25, config.jitterFraction());
            assertFalse(config.preserveExpiry());
            assertTrue(config.preserveSessionOrdering());
            assertEquals(Duration.ofMillis(250), config.sessionOrderingIncrement());
            assertEquals(MessageExpiryStrategy.REJECT, config.expiryStrategy());
        });
    }

    @Test
    void linearIncrementDefaultsToBaseDelay() {
        runner.withPropertyValues(
                "requeue.retry.strategy=linear",
                "requeue.retry.base-delay=2s"
        ).run(ctx -> {
            RetryConfiguration config = ctx.getBean(RetryConfiguration.class);
            assertEquals(BackoffStrategy.LINEAR, config.strategy());
            assertEquals(Duration.ofSeconds(2), config.linearIncrement());
        });
    }

    @Test
    void unknownStrategyFailsStartup() {
        runner.withPropertyValues("requeue.retry.strategy=fibonacci").run(ctx -> {
            Throwable failure = ctx.getStartupFailure();
            assertNotNull(failure);
            Throwable root = rootCause(failure);
            UnknownStrategyException e = assertInstanceOf(UnknownStrategyException.class, root);
            assertEquals("fibonacci", e.strategyName());
        });
    }

    @Test
    void userBeansTakePrecedence() {
        runner.withUserConfiguration(CustomBeansConfig.class).run(ctx -> {
            RetryEngine engine = ctx.getBean(RetryEngine.class);
            assertEquals(9, engine.defaultConfiguration().maxRetries());
            assertSame(CustomBeansConfig.STORE, engine.sessionStore());
            assertEquals(1, ctx.getBeansOfType(RetryConfiguration.class).size());
        });
    }

    @Test
    void applicationObjectMapperReused() {
        runner.withUserConfiguration(ObjectMapperConfig.class).run(ctx -> {
            EnvelopeCodec codec = ctx.getBean(EnvelopeCodec.class);
            assertInstanceOf(JacksonEnvelopeCodec.class, codec);
            assertNotSame(EnvelopeCodec.getDefault(), codec);
        });
    }

    @Test
    void engineCreatesWorkingOrchestrators() {
        runner.run(ctx -> {
            RetryEngine engine = ctx.getBean(RetryEngine.class);
            RetryOrchestrator<String, String> orchestrator = engine.orchestrator(String.class,
                    message -> { },
                    (payload, context) -> payload.toUpperCase());

            RetryOutcome<String> outcome = orchestrator.process(
                    InboundMessage.of("\"hello\"", TriggerMetadata.empty()));

            assertEquals(new RetryOutcome.Succeeded<>("HELLO"), outcome);
        });
    }

    private static Throwable rootCause(Throwable t) {
        Throwable current = t;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    @Configuration
    static class CustomBeansConfig {
        static final SessionOrderingStore STORE = new InMemorySessionOrderingStore(4);

        @Bean
        RetryConfiguration customRetryConfiguration() {
            return RetryConfiguration.builder().maxRetries(9).baseDelay(Duration.ofSeconds(10)).build();
        }

        @Bean
        SessionOrderingStore customSessionStore() {
            return STORE;
        }
    }

    @Configuration
    static class ObjectMapperConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }
}
