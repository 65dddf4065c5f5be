/**
 * Backoff delay computation.
 *
 * @see io.requeue.backoff.BackoffCalculator
 */
package io.requeue.backoff;
