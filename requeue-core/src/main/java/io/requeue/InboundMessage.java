package io.requeue;

import java.util.Objects;

/**
 * One delivery as handed over by the host trigger runtime.
 *
 * @param body        raw message body
 * @param metadata    delivery metadata
 * @param hostContext opaque per-invocation handle (logger, binding context, ...), passed to the
 *                    handler untouched; may be null
 */
public record InboundMessage(String body, TriggerMetadata metadata, Object hostContext) {

    public InboundMessage {
        Objects.requireNonNull(body, "body");
        metadata = metadata == null ? TriggerMetadata.empty() : metadata;
    }

    public static InboundMessage of(String body, TriggerMetadata metadata) {
        return new InboundMessage(body, metadata, null);
    }
}
