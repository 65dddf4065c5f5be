package io.requeue;

import java.util.Objects;

/**
 * Invocation context passed to a {@link RetryHandler}: the host's context plus retry state.
 *
 * @param originalBindingData metadata of the first delivery
 * @param publishCount        1 on first delivery, incremented by each retry
 * @param triggerMetadata     metadata of the current delivery
 * @param hostContext         the host runtime's opaque handle, or null
 */
public record RetryContext(
        OriginalBindingData originalBindingData,
        int publishCount,
        TriggerMetadata triggerMetadata,
        Object hostContext) {

    public RetryContext {
        Objects.requireNonNull(originalBindingData, "originalBindingData");
        Objects.requireNonNull(triggerMetadata, "triggerMetadata");
    }

    /**
     * Returns true on the first delivery of a message.
     */
    public boolean firstDelivery() {
        return publishCount == 1;
    }

    /**
     * Returns the host context cast to the type the caller expects.
     *
     * @throws ClassCastException if the host context is of another type
     */
    public <C> C hostContext(Class<C> type) {
        return type.cast(hostContext);
    }
}
