/**
 * Wire format of retry envelopes.
 */
package io.requeue.codec;
