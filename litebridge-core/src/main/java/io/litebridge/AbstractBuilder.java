package io.litebridge;

import io.litebridge.actor.ActorOptions;
import io.litebridge.sqlite.SqliteConnectionFactory;
import io.litebridge.spi.ConnectionFactory;
import io.litebridge.spi.MetricsExporter;
import io.litebridge.util.DaemonThreadFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Settings shared by {@link ClientBuilder} and {@link PoolBuilder}.
 *
 * <p>Connection settings are forwarded as-is to the SQLite driver; nothing here
 * interprets them. A custom {@link ConnectionFactory} replaces them entirely.
 *
 * @param <B> the concrete builder type (CRTP)
 */
public abstract sealed class AbstractBuilder<B extends AbstractBuilder<B>>
        permits ClientBuilder, PoolBuilder {

    Path path;
    JournalMode journalMode;
    final Set<OpenFlag> flags = EnumSet.noneOf(OpenFlag.class);
    final List<String> pragmas = new ArrayList<>();
    ConnectionFactory connectionFactory;
    MetricsExporter metrics;
    Duration drainTimeout;
    String threadNamePrefix = ActorOptions.DEFAULT_THREAD_PREFIX;
    Executor closeExecutor;
    Executor completionExecutor;
    private final AtomicBoolean built = new AtomicBoolean(false);

    AbstractBuilder() {}

    /**
     * Marks this builder as used, preventing reuse.
     *
     * @throws IllegalStateException if open() was already called
     */
    void markBuilt() {
        if (!built.compareAndSet(false, true)) {
            throw new IllegalStateException("open() already called on this builder");
        }
    }

    @SuppressWarnings("unchecked")
    private B self() {
        return (B) this;
    }

    /**
     * Sets the database file. Without a path the database lives in memory, one
     * separate database per connection.
     *
     * @param path the database file
     * @return this builder
     */
    public B path(Path path) {
        this.path = Objects.requireNonNull(path, "path");
        return self();
    }

    /**
     * Sets the journal mode applied right after each connection opens.
     *
     * <p>Optional. Defaults to the engine's own default.
     *
     * @param journalMode the journal mode
     * @return this builder
     */
    public B journalMode(JournalMode journalMode) {
        this.journalMode = Objects.requireNonNull(journalMode, "journalMode");
        return self();
    }

    /**
     * Replaces the open flags.
     *
     * <p>Optional. Without flags the driver opens read/write and creates the file.
     *
     * @param flags the open flags
     * @return this builder
     */
    public B flags(OpenFlag... flags) {
        this.flags.clear();
        this.flags.addAll(Arrays.asList(flags));
        return self();
    }

    /**
     * Appends a statement executed on each connection after it opens,
     * e.g. {@code "PRAGMA foreign_keys = ON"}.
     *
     * @param statement the statement
     * @return this builder
     */
    public B pragma(String statement) {
        this.pragmas.add(Objects.requireNonNull(statement, "statement"));
        return self();
    }

    /**
     * Uses a custom connection factory instead of the SQLite one, e.g. a
     * {@link io.litebridge.jdbc.DataSourceConnectionFactory}. Cannot be combined with
     * path, journal mode, flags or pragmas.
     *
     * @param connectionFactory the connection factory
     * @return this builder
     */
    public B connectionFactory(ConnectionFactory connectionFactory) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        return self();
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public B metrics(MetricsExporter metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        return self();
    }

    /**
     * Sets how long close waits for queued jobs before failing with {@link JoinException}
     * and cancelling the jobs not yet started.
     *
     * <p>Optional. By default close waits for as long as the queued jobs take.
     *
     * @param drainTimeout maximum drain time, must be positive
     * @return this builder
     */
    public B drainTimeout(Duration drainTimeout) {
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
        return self();
    }

    /**
     * Sets the prefix of actor thread names.
     *
     * <p>Optional. Defaults to {@code "litebridge-"}.
     *
     * @param threadNamePrefix the prefix
     * @return this builder
     */
    public B threadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
        return self();
    }

    /**
     * Sets the executor that waits for actor threads to exit on close.
     *
     * <p>Optional. Defaults to a shared pool of daemon threads.
     *
     * @param closeExecutor the executor
     * @return this builder
     */
    public B closeExecutor(Executor closeExecutor) {
        this.closeExecutor = Objects.requireNonNull(closeExecutor, "closeExecutor");
        return self();
    }

    /**
     * Executor that completes result futures, so stages attached without an explicit
     * executor run there instead of on a connection thread. Defaults to
     * {@link ForkJoinPool#commonPool()}.
     *
     * @param completionExecutor the executor
     * @return this builder
     */
    public B completionExecutor(Executor completionExecutor) {
        this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor");
        return self();
    }

    ConnectionFactory resolveConnectionFactory() {
        if (connectionFactory == null) {
            return new SqliteConnectionFactory(path, journalMode, flags, pragmas);
        }
        if (path != null || journalMode != null || !flags.isEmpty() || !pragmas.isEmpty()) {
            throw new IllegalStateException(
                    "connectionFactory cannot be combined with path, journalMode, flags or pragmas");
        }
        return connectionFactory;
    }

    ActorOptions actorOptions(String role) {
        return new ActorOptions(
                new DaemonThreadFactory(threadNamePrefix + role + "-"),
                metrics != null ? metrics : MetricsExporter.NOOP,
                drainTimeout,
                closeExecutor != null ? closeExecutor : ActorOptions.defaultCloser(),
                completionExecutor != null ? completionExecutor : ForkJoinPool.commonPool());
    }
}
