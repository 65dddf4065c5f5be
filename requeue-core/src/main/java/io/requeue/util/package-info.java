/**
 * Small shared helpers.
 */
package io.requeue.util;
