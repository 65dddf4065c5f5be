/**
 * Expiry preservation across retries.
 */
package io.requeue.expiry;
