package io.litebridge;

import io.litebridge.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsExporter} that keeps every counter in memory for assertions.
 */
public final class RecordingMetricsExporter implements MetricsExporter {
    public final AtomicInteger submitted = new AtomicInteger();
    public final AtomicInteger rejected = new AtomicInteger();
    public final AtomicInteger completed = new AtomicInteger();
    public final AtomicInteger failed = new AtomicInteger();
    public final AtomicInteger panicked = new AtomicInteger();
    public final AtomicLong executions = new AtomicLong();
    public final Map<String, Integer> queueDepths = new ConcurrentHashMap<>();

    @Override
    public void incrementSubmitted() {
        submitted.incrementAndGet();
    }

    @Override
    public void incrementRejected() {
        rejected.incrementAndGet();
    }

    @Override
    public void incrementCompleted() {
        completed.incrementAndGet();
    }

    @Override
    public void incrementFailed() {
        failed.incrementAndGet();
    }

    @Override
    public void incrementPanicked() {
        panicked.incrementAndGet();
    }

    @Override
    public void recordQueueDepth(String actorName, int depth) {
        queueDepths.put(actorName, depth);
    }

    @Override
    public void recordExecutionNanos(long durationNanos) {
        executions.incrementAndGet();
    }
}
