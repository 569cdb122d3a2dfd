package io.litebridge.actor;

import io.litebridge.spi.MetricsExporter;
import io.litebridge.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadFactory;

/**
 * Runtime settings shared by the actors of a client or pool.
 *
 * @param threadFactory creates each actor's dedicated thread; the thread name is the actor name
 * @param metrics       receives job counters and queue depths
 * @param drainTimeout  how long close waits for queued jobs before giving up,
 *                      or {@code null} to wait for as long as they take
 * @param closer        runs the blocking thread join behind {@link ConnectionActor#closeAsync()}
 * @param completer     completes job futures, so dependent stages run off the actor thread
 */
public record ActorOptions(ThreadFactory threadFactory, MetricsExporter metrics,
                           Duration drainTimeout, Executor closer, Executor completer) {

    public static final String DEFAULT_THREAD_PREFIX = "litebridge-";

    private static final ExecutorService DEFAULT_CLOSER =
            Executors.newCachedThreadPool(new DaemonThreadFactory(DEFAULT_THREAD_PREFIX + "closer-"));

    public ActorOptions {
        Objects.requireNonNull(threadFactory, "threadFactory");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(closer, "closer");
        Objects.requireNonNull(completer, "completer");
        if (drainTimeout != null && (drainTimeout.isNegative() || drainTimeout.isZero())) {
            throw new IllegalArgumentException("drainTimeout must be > 0");
        }
    }

    /**
     * Options that complete job futures on {@link ForkJoinPool#commonPool()}.
     */
    public ActorOptions(ThreadFactory threadFactory, MetricsExporter metrics,
                        Duration drainTimeout, Executor closer) {
        this(threadFactory, metrics, drainTimeout, closer, ForkJoinPool.commonPool());
    }

    /**
     * Returns the shared executor used to join actor threads when none is configured.
     *
     * @return the default closer
     */
    public static Executor defaultCloser() {
        return DEFAULT_CLOSER;
    }
}
