package io.requeue.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.requeue.Delivery;
import io.requeue.OriginalBindingData;
import io.requeue.RetryEnvelope;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EnvelopeCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>String payloads get special treatment on first delivery: a body that is a JSON string
 * literal is unquoted, and any other body (plain text, or JSON that is not a string) is passed
 * through as-is. Other payload types are bound from the parsed JSON.
 *
 * <p>This class is thread-safe once constructed.
 */
public final class JacksonEnvelopeCodec implements EnvelopeCodec {
    private static final Logger logger = Logger.getLogger(JacksonEnvelopeCodec.class.getName());

    static final JacksonEnvelopeCodec INSTANCE = new JacksonEnvelopeCodec();

    private static final String KIND = "kind";
    private static final String PAYLOAD = "payload";
    private static final String ORIGINAL_BINDING_DATA = "originalBindingData";
    private static final String PUBLISH_COUNT = "publishCount";

    private final ObjectMapper mapper;

    /**
     * Creates a codec with a private mapper that tolerates unknown properties.
     */
    public JacksonEnvelopeCodec() {
        this(new ObjectMapper()
                .findAndRegisterModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    /**
     * Creates a codec using an application-configured mapper.
     *
     * @param mapper the mapper; its configuration governs payload binding
     */
    public JacksonEnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public <T> Delivery<T> decode(String body, Type payloadType) {
        Objects.requireNonNull(body, "body");
        JavaType type = mapper.getTypeFactory().constructType(Objects.requireNonNull(payloadType, "payloadType"));
        JsonNode tree = parseOrNull(body);
        if (isRetryEnvelope(tree)) {
            return new Delivery.RetryDelivery<>(readEnvelope(tree, type));
        }
        return new Delivery.FirstDelivery<>(readFirstPayload(body, tree, type));
    }

    @Override
    public String encode(RetryEnvelope<?> envelope) {
        Objects.requireNonNull(envelope, "envelope");
        try {
            ObjectNode root = mapper.createObjectNode();
            root.put(KIND, RETRY_KIND);
            root.set(PAYLOAD, mapper.valueToTree(envelope.payload()));
            root.set(ORIGINAL_BINDING_DATA, mapper.valueToTree(envelope.originalBindingData()));
            root.put(PUBLISH_COUNT, envelope.publishCount());
            return mapper.writeValueAsString(root);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new EnvelopeFormatException("Failed to serialize retry envelope", e);
        }
    }

    private JsonNode parseOrNull(String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.log(Level.FINE, "Body is not JSON; treating it as raw text", e);
            return null;
        }
    }

    private static boolean isRetryEnvelope(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            return false;
        }
        if (tree.has(KIND)) {
            return RETRY_KIND.equals(tree.get(KIND).asText(null));
        }
        return isUntaggedEnvelope(tree);
    }

    // envelopes written before the kind tag existed
    private static boolean isUntaggedEnvelope(JsonNode tree) {
        JsonNode count = tree.get(PUBLISH_COUNT);
        JsonNode binding = tree.get(ORIGINAL_BINDING_DATA);
        return count != null && count.isIntegralNumber() && binding != null && binding.isObject();
    }

    private <T> RetryEnvelope<T> readEnvelope(JsonNode tree, JavaType type) {
        JsonNode count = tree.get(PUBLISH_COUNT);
        if (count == null || !count.canConvertToInt() || !count.isIntegralNumber() || count.intValue() < 1) {
            throw new EnvelopeFormatException("Retry envelope has no valid publishCount: " + count);
        }
        JsonNode binding = tree.get(ORIGINAL_BINDING_DATA);
        if (binding == null || !binding.isObject()) {
            throw new EnvelopeFormatException("Retry envelope has no originalBindingData object");
        }
        OriginalBindingData originalBindingData;
        try {
            originalBindingData = mapper.treeToValue(binding, OriginalBindingData.class);
        } catch (JsonProcessingException e) {
            throw new EnvelopeFormatException("Invalid originalBindingData", e);
        }
        T payload = readPayload(tree.get(PAYLOAD), type);
        return new RetryEnvelope<>(payload, originalBindingData, count.intValue());
    }

    private <T> T readFirstPayload(String body, JsonNode tree, JavaType type) {
        if (type.hasRawClass(String.class)) {
            @SuppressWarnings("unchecked")
            T text = (T) (tree != null && tree.isTextual() ? tree.textValue() : body);
            return text;
        }
        if (tree == null) {
            throw new EnvelopeFormatException("Body is not valid JSON for payload type " + type);
        }
        return readPayload(tree, type);
    }

    private <T> T readPayload(JsonNode node, JavaType type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (type.hasRawClass(String.class)) {
            @SuppressWarnings("unchecked")
            T text = (T) (node.isTextual() ? node.textValue() : node.toString());
            return text;
        }
        try {
            return mapper.readerFor(type).readValue(node);
        } catch (IOException e) {
            throw new EnvelopeFormatException("Cannot bind payload to " + type, e);
        }
    }
}
