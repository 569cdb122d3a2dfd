package io.litebridge.micrometer;

import io.litebridge.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code litebridge.jobs.submitted}: jobs accepted into an actor queue</li>
 *   <li>{@code litebridge.jobs.rejected}: jobs refused because the actor was closed</li>
 *   <li>{@code litebridge.jobs.completed}: callbacks that returned normally</li>
 *   <li>{@code litebridge.jobs.failed}: callbacks that threw an SQL error</li>
 *   <li>{@code litebridge.jobs.panicked}: callbacks that terminated abnormally</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code litebridge.queue.depth}, tagged {@code actor}: jobs waiting per actor</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code litebridge.job.execution.ms}: time a callback ran on its actor thread</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Counter submitted;
    private final Counter rejected;
    private final Counter completed;
    private final Counter failed;
    private final Counter panicked;
    private final DistributionSummary executionTime;

    private final Map<String, AtomicInteger> queueDepths = new ConcurrentHashMap<>();
    private final Map<String, Gauge> queueDepthGauges = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "litebridge"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "litebridge");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for several pools in one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.db"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.submitted = Counter.builder(namePrefix + ".jobs.submitted")
                .description("Jobs accepted into a connection actor queue")
                .register(registry);
        this.rejected = Counter.builder(namePrefix + ".jobs.rejected")
                .description("Jobs rejected because the connection was closed")
                .register(registry);
        this.completed = Counter.builder(namePrefix + ".jobs.completed")
                .description("Callbacks that returned normally")
                .register(registry);
        this.failed = Counter.builder(namePrefix + ".jobs.failed")
                .description("Callbacks that threw an SQL error")
                .register(registry);
        this.panicked = Counter.builder(namePrefix + ".jobs.panicked")
                .description("Callbacks that terminated abnormally")
                .register(registry);
        this.executionTime = DistributionSummary.builder(namePrefix + ".job.execution.ms")
                .description("Callback execution time on the actor thread")
                .baseUnit("milliseconds")
                .register(registry);
    }

    @Override
    public void incrementSubmitted() {
        if (closed) return;
        submitted.increment();
    }

    @Override
    public void incrementRejected() {
        if (closed) return;
        rejected.increment();
    }

    @Override
    public void incrementCompleted() {
        if (closed) return;
        completed.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementPanicked() {
        if (closed) return;
        panicked.increment();
    }

    @Override
    public void recordQueueDepth(String actorName, int depth) {
        if (closed) return;
        queueDepths.computeIfAbsent(actorName, this::registerDepthGauge).set(depth);
    }

    @Override
    public void recordExecutionNanos(long durationNanos) {
        if (closed) return;
        executionTime.record(durationNanos / 1_000_000.0);
    }

    private AtomicInteger registerDepthGauge(String actorName) {
        AtomicInteger depth = new AtomicInteger();
        queueDepthGauges.put(actorName, Gauge.builder(namePrefix + ".queue.depth", depth, AtomicInteger::get)
                .description("Jobs waiting in a connection actor queue")
                .tag("actor", actorName)
                .register(registry));
        return depth;
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this once the pool or client using the exporter is closed, to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(submitted, rejected, completed, failed, panicked, executionTime));
        meters.addAll(queueDepthGauges.values());
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        queueDepthGauges.clear();
        queueDepths.clear();
        if (first != null) throw first;
    }
}
