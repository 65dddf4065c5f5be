/**
 * Per-session coordination of pending retries.
 *
 * <p>{@link io.requeue.session.SessionOrderingStore} is the seam; the engine ships only the
 * process-local {@link io.requeue.session.InMemorySessionOrderingStore}.
 */
package io.requeue.session;
