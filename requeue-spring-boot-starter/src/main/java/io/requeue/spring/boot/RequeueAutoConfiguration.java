package io.requeue.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.requeue.RetryConfiguration;
import io.requeue.RetryEngine;
import io.requeue.codec.EnvelopeCodec;
import io.requeue.codec.JacksonEnvelopeCodec;
import io.requeue.session.InMemorySessionOrderingStore;
import io.requeue.session.SessionOrderingStore;
import io.requeue.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the retry engine.
 *
 * <p>Binds {@link RequeueProperties} into a default {@link RetryConfiguration} and wires a
 * {@link RetryEngine} from it. Applications create their per-stream orchestrators from the engine.
 * Every bean backs off when the application defines its own.
 *
 * @see RequeueProperties
 * @see RequeueMicrometerAutoConfiguration
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration")
@ConditionalOnClass(RetryEngine.class)
@EnableConfigurationProperties(RequeueProperties.class)
public class RequeueAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryConfiguration retryConfiguration(RequeueProperties props) {
        RequeueProperties.Retry retry = props.getRetry();
        return RetryConfiguration.builder()
                .maxRetries(retry.getMaxRetries())
                .strategy(retry.getStrategy())
                .baseDelay(retry.getBaseDelay())
                .maxDelay(retry.getMaxDelay())
                .exponentialFactor(retry.getExponentialFactor())
                .linearIncrement(retry.getLinearIncrement())
                .jitterFraction(retry.getJitterFraction())
                .preserveExpiry(retry.isPreserveExpiry())
                .preserveSessionOrdering(retry.isPreserveSessionOrdering())
                .sessionOrderingIncrement(retry.getSessionOrderingIncrement())
                .expiryStrategy(retry.getExpiryStrategy())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionOrderingStore sessionOrderingStore(RequeueProperties props) {
        return new InMemorySessionOrderingStore(props.getSessionStore().getLockStripes());
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper mapper = objectMapperProvider.getIfUnique();
        return mapper != null ? new JacksonEnvelopeCodec(mapper) : EnvelopeCodec.getDefault();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryEngine retryEngine(RetryConfiguration retryConfiguration,
                                   SessionOrderingStore sessionOrderingStore,
                                   EnvelopeCodec envelopeCodec,
                                   ObjectProvider<MetricsExporter> metricsProvider) {
        RetryEngine.Builder builder = RetryEngine.builder()
                .defaultConfiguration(retryConfiguration)
                .sessionStore(sessionOrderingStore)
                .codec(envelopeCodec);
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }
}
