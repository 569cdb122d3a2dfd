package io.litebridge.actor;

import io.litebridge.ClosedException;
import io.litebridge.ConnectionCallback;
import io.litebridge.ExecutionFailedException;
import io.litebridge.PanicException;
import io.litebridge.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One submitted callback paired with the future its caller awaits.
 *
 * <p>The queue only sees {@link Command}; the completion keeps the caller's result type,
 * so the value arrives already typed. Whatever happens, the completion is fulfilled
 * exactly once: by {@link #run} or by {@link #cancel}. Completing a future the caller
 * has already cancelled is a no-op.
 *
 * <p>Completions are handed to the completer executor so that dependent stages never
 * run on the actor thread.
 */
final class Job<T> implements Command {
    private static final Logger logger = Logger.getLogger(Job.class.getName());

    private final ConnectionCallback<T> callback;
    private final CompletableFuture<T> completion;

    Job(ConnectionCallback<T> callback, CompletableFuture<T> completion) {
        this.callback = callback;
        this.completion = completion;
    }

    void run(Connection conn, String actorName, MetricsExporter metrics, Executor completer) {
        long start = System.nanoTime();
        T value;
        try {
            value = callback.execute(conn);
        } catch (SQLException e) {
            recordOutcome(metrics, start, metrics::incrementFailed);
            fail(new ExecutionFailedException(e), completer);
            return;
        } catch (Throwable t) {
            recordOutcome(metrics, start, metrics::incrementPanicked);
            fail(new PanicException("Connection callback terminated abnormally on " + actorName, t), completer);
            return;
        }
        recordOutcome(metrics, start, metrics::incrementCompleted);
        deliver(() -> completion.complete(value), completer);
    }

    void cancel(ClosedException reason, Executor completer) {
        fail(reason, completer);
    }

    private void fail(RuntimeException error, Executor completer) {
        deliver(() -> completion.completeExceptionally(error), completer);
    }

    private static void deliver(Runnable completeAction, Executor completer) {
        try {
            completer.execute(completeAction);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Completion executor rejected a result; completing on the actor thread", e);
            completeAction.run();
        }
    }

    // Recorded before delivery so a caller that has seen the result also sees the counters.
    private static void recordOutcome(MetricsExporter metrics, long start, Runnable counter) {
        try {
            metrics.recordExecutionNanos(Math.max(0L, System.nanoTime() - start));
            counter.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Metrics exporter failed while recording a job outcome", e);
        }
    }
}
