package io.litebridge.spi;

/**
 * Observability hook for exporting connection actor counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. Methods are called
 * from caller threads and actor threads concurrently and must not block.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of jobs accepted into an actor queue.
     */
    void incrementSubmitted();

    /**
     * Increments the count of jobs rejected because the actor was closing or closed.
     */
    void incrementRejected();

    /**
     * Increments the count of jobs whose callback returned normally.
     */
    void incrementCompleted();

    /**
     * Increments the count of jobs whose callback threw an {@link java.sql.SQLException}.
     */
    void incrementFailed();

    /**
     * Increments the count of jobs whose callback terminated abnormally.
     */
    void incrementPanicked();

    /**
     * Records the number of jobs waiting in one actor's queue.
     *
     * @param actorName the actor name, also its thread name
     * @param depth     number of queued jobs
     */
    void recordQueueDepth(String actorName, int depth);

    /**
     * Records how long a callback ran on its actor thread.
     *
     * @param durationNanos execution time in nanoseconds (always non-negative)
     */
    default void recordExecutionNanos(long durationNanos) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSubmitted() {
        }

        @Override
        public void incrementRejected() {
        }

        @Override
        public void incrementCompleted() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementPanicked() {
        }

        @Override
        public void recordQueueDepth(String actorName, int depth) {
        }
    }
}
