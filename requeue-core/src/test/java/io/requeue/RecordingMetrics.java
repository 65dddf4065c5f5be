package io.requeue;

import io.requeue.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

class RecordingMetrics implements MetricsExporter {
    final AtomicInteger succeeded = new AtomicInteger();
    final AtomicInteger retryScheduled = new AtomicInteger();
    final AtomicInteger deferred = new AtomicInteger();
    final AtomicInteger exhausted = new AtomicInteger();
    final AtomicInteger expired = new AtomicInteger();
    final AtomicInteger ignored = new AtomicInteger();
    volatile long lastRetryDelayMs = -1;

    @Override
    public void incrementSucceeded() {
        succeeded.incrementAndGet();
    }

    @Override
    public void incrementRetryScheduled() {
        retryScheduled.incrementAndGet();
    }

    @Override
    public void incrementDeferred() {
        deferred.incrementAndGet();
    }

    @Override
    public void incrementExhausted() {
        exhausted.incrementAndGet();
    }

    @Override
    public void incrementExpired() {
        expired.incrementAndGet();
    }

    @Override
    public void incrementIgnored() {
        ignored.incrementAndGet();
    }

    @Override
    public void recordRetryDelayMs(long delayMs) {
        lastRetryDelayMs = delayMs;
    }
}
