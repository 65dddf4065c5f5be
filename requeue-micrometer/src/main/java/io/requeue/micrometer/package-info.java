/**
 * Micrometer bridge for the retry engine's {@link io.requeue.spi.MetricsExporter} hook.
 */
package io.requeue.micrometer;
