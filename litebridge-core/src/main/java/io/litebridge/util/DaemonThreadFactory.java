package io.litebridge.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Names the threads litebridge starts: one per connection actor and the pooled threads
 * that join actors on close.
 *
 * <p>An actor's name is its thread's name, so a builder gives each role its own prefix
 * ({@code litebridge-conn-1} for a client, {@code litebridge-pool-1} onwards for a pool's
 * writer and readers, {@code litebridge-closer-1} for close joins).
 * Threads are daemons: a client the application forgets to close leaves its connection
 * open but never holds the JVM up. Anything escaping a thread's task is logged.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
            logger.log(Level.SEVERE, "Uncaught failure on " + thread.getName(), error);

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger(1);

    /**
     * @param prefix thread name prefix, followed by a per-factory sequence number
     */
    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
        return thread;
    }
}
