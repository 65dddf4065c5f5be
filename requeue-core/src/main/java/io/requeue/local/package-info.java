/**
 * In-process queue and consumer for running the engine without a broker, in tests and demos.
 *
 * @see io.requeue.local.InMemoryQueue
 * @see io.requeue.local.LocalQueueConsumer
 */
package io.requeue.local;
