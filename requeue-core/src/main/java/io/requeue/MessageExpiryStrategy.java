package io.requeue;

/**
 * What to do with a delivery whose original deadline has already passed when it arrives.
 *
 * <p>Independent of this setting, expiry is always checked again when a retry is about to be
 * scheduled.
 */
public enum MessageExpiryStrategy {
    /** Run the handler anyway. */
    HANDLE,
    /** Skip the handler and fail the delivery with {@link MessageExpiredException}. */
    REJECT,
    /** Skip the handler and consume the delivery silently. */
    IGNORE
}
