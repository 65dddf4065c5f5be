/**
 * Service provider interfaces the engine is wired against.
 *
 * <p>{@link io.requeue.spi.MessagePublisher} is the outbound publisher;
 * {@link io.requeue.spi.MetricsExporter} receives counters.
 */
package io.requeue.spi;
