package io.litebridge.actor;

import io.litebridge.ClosedException;
import io.litebridge.ConnectionCallback;
import io.litebridge.JoinException;
import io.litebridge.OpenException;
import io.litebridge.spi.ConnectionFactory;
import io.litebridge.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one JDBC {@link Connection} and the dedicated thread that uses it.
 *
 * <p>Callers hand work over with {@link #submit}; the actor thread takes jobs from an
 * unbounded FIFO queue and runs them one at a time against its connection, so at most
 * one callback touches the connection at any instant and jobs run in arrival order.
 * Each job's result or failure is delivered through the future returned by
 * {@code submit}. Enqueueing never blocks the caller.
 *
 * <p>Failures are mapped onto the litebridge taxonomy: a callback's
 * {@link SQLException} becomes {@link io.litebridge.ExecutionFailedException}, any other
 * throwable becomes {@link io.litebridge.PanicException}, and work submitted after
 * {@link #closeAsync()} fails with {@link ClosedException}. Cancelling a returned future
 * does not interrupt a callback that is already running.
 *
 * <p>Futures are completed through the options' completer executor, never directly on
 * the actor thread, so non-async stages attached by callers (such as {@code thenApply})
 * cannot stall or deadlock the actor. An interrupt flag left set by a callback is
 * cleared before the next job; only an abandoned close (drain timeout) stops the loop
 * through interruption.
 *
 * <p>This class is thread-safe. Create instances via {@link #open}.
 */
public final class ConnectionActor {
    private static final Logger logger = Logger.getLogger(ConnectionActor.class.getName());

    private final BlockingQueue<Command> queue = new LinkedBlockingQueue<>();
    private final MetricsExporter metrics;
    private final Duration drainTimeout;
    private final Executor closer;
    private final Executor completer;
    private final Object lock = new Object();

    private volatile Thread thread;
    private volatile boolean terminated;
    private volatile Throwable closeFailure;
    private volatile boolean abandoned;

    // Touched by the actor thread only.
    private Connection connection;

    // Guarded by lock.
    private boolean accepting = true;
    private CompletableFuture<Void> closeFuture;

    private ConnectionActor(ActorOptions options) {
        this.metrics = options.metrics();
        this.drainTimeout = options.drainTimeout();
        this.closer = options.closer();
        this.completer = options.completer();
    }

    /**
     * Starts an actor: spawns its thread, which opens the connection and then enters the
     * receive loop.
     *
     * <p>The returned future completes once the connection is open. It fails with
     * {@link OpenException} if the thread cannot be spawned or the factory fails, in
     * which case the thread has already exited. Cancelling the returned future before it
     * completes makes the actor close its connection and exit.
     *
     * @param factory opens the connection, called on the actor thread
     * @param options thread, metrics and shutdown settings
     * @return a future for the running actor
     */
    public static CompletableFuture<ConnectionActor> open(ConnectionFactory factory, ActorOptions options) {
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(options, "options");

        ConnectionActor actor = new ConnectionActor(options);
        CompletableFuture<ConnectionActor> opened = new CompletableFuture<>();
        try {
            Thread t = options.threadFactory().newThread(() -> actor.run(factory, opened));
            if (t == null) {
                return CompletableFuture.failedFuture(
                        new OpenException("Thread factory refused to create a connection actor thread"));
            }
            actor.thread = t;
            t.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            return CompletableFuture.failedFuture(
                    new OpenException("Failed to spawn connection actor thread", e));
        }
        return opened;
    }

    /**
     * Queues a callback for execution on this actor's connection.
     *
     * <p>If the actor is closing or closed, the returned future is already failed with
     * {@link ClosedException}. Otherwise it completes with the callback's value, or fails
     * with {@link io.litebridge.ExecutionFailedException} or
     * {@link io.litebridge.PanicException}.
     *
     * @param callback the work to run
     * @param <T>      result type
     * @return the job's result
     */
    public <T> CompletableFuture<T> submit(ConnectionCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        CompletableFuture<T> completion;
        synchronized (lock) {
            if (!accepting) {
                recordMetrics(metrics::incrementRejected);
                return CompletableFuture.failedFuture(closed());
            }
            completion = new CompletableFuture<>();
            queue.add(new Job<>(callback, completion));
        }
        recordMetrics(metrics::incrementSubmitted);
        recordMetrics(() -> metrics.recordQueueDepth(name(), queue.size()));
        return completion;
    }

    /**
     * Stops accepting work and shuts the actor down once every job queued so far has run.
     *
     * <p>The blocking join on the actor thread runs on the configured closer executor,
     * never on the calling thread. Repeated calls return the outcome of the first one.
     * The future fails with {@link JoinException} if the connection could not be closed,
     * the drain timeout elapsed (queued jobs not yet started are then failed with
     * {@link ClosedException}) or the join was interrupted.
     *
     * @return a future completing when the actor thread has exited
     */
    public CompletableFuture<Void> closeAsync() {
        CompletableFuture<Void> result;
        synchronized (lock) {
            if (closeFuture != null) {
                return closeFuture.copy();
            }
            closeFuture = new CompletableFuture<>();
            result = closeFuture;
            if (accepting) {
                accepting = false;
                queue.add(Command.Shutdown.INSTANCE);
            }
        }
        try {
            closer.execute(() -> awaitTermination(result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new JoinException("Closer executor rejected join of " + name(), e));
        }
        return result.copy();
    }

    /**
     * Returns the actor name, which is also the name of its thread.
     *
     * @return the actor name
     */
    public String name() {
        return thread.getName();
    }

    /**
     * Returns {@code true} once the actor stopped accepting work.
     *
     * @return whether close has begun or the actor thread exited
     */
    public boolean isClosed() {
        synchronized (lock) {
            return !accepting;
        }
    }

    /**
     * Returns {@code true} once the actor thread has released its connection, or close
     * gave up waiting for it.
     *
     * @return whether the actor is terminated
     */
    public boolean isTerminated() {
        return terminated;
    }

    public int queueDepth() {
        return queue.size();
    }

    private void run(ConnectionFactory factory, CompletableFuture<ConnectionActor> opened) {
        try {
            connection = Objects.requireNonNull(factory.open(), "factory returned a null connection");
        } catch (Throwable t) {
            stopAccepting();
            terminated = true;
            OpenException failure = t instanceof OpenException oe
                    ? oe : new OpenException("Failed to open connection for " + name(), t);
            completeOff(() -> opened.completeExceptionally(failure));
            return;
        }

        if (opened.isDone()) {
            logger.fine(() -> "Open of " + name() + " was abandoned; closing connection");
            stopAccepting();
            shutdown();
            return;
        }
        completeOff(() -> {
            if (!opened.complete(this)) {
                logger.fine(() -> "Open of " + name() + " was abandoned; closing connection");
                closeAsync();
            }
        });
        logger.fine(() -> "Connection actor started: " + name());

        try {
            receiveLoop();
        } finally {
            stopAccepting();
            shutdown();
            logger.fine(() -> "Connection actor stopped: " + name());
        }
    }

    private void receiveLoop() {
        String name = name();
        while (!abandoned) {
            Command command;
            try {
                command = queue.take();
            } catch (InterruptedException e) {
                if (abandoned) {
                    break;
                }
                logger.fine(() -> "Ignoring stray interrupt on " + name);
                continue;
            }
            if (command == Command.Shutdown.INSTANCE) {
                return;
            }
            try {
                ((Job<?>) command).run(connection, name, metrics, completer);
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Connection actor loop error on " + name, t);
            }
            // A callback may leave the interrupt flag set; it must not end the loop.
            Thread.interrupted();
            recordMetrics(() -> metrics.recordQueueDepth(name, queue.size()));
        }
        logger.warning("Connection actor close abandoned; cancelling queued jobs: " + name);
    }

    private void stopAccepting() {
        synchronized (lock) {
            accepting = false;
        }
    }

    private void shutdown() {
        Throwable failure = null;
        try {
            connection.close();
        } catch (SQLException | RuntimeException e) {
            failure = e;
            logger.log(Level.SEVERE, "Failed to close connection of " + name(), e);
        } finally {
            connection = null;
        }
        cancelRemaining();
        closeFailure = failure;
        terminated = true;
    }

    private void cancelRemaining() {
        Command command;
        int cancelled = 0;
        while ((command = queue.poll()) != null) {
            if (command instanceof Job<?> job) {
                job.cancel(closed(), completer);
                cancelled++;
            }
        }
        if (cancelled > 0) {
            logger.warning("Cancelled " + cancelled + " queued jobs on " + name());
        }
        recordMetrics(() -> metrics.recordQueueDepth(name(), 0));
    }

    private void completeOff(Runnable completeAction) {
        try {
            completer.execute(completeAction);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Completion executor rejected open result of " + name(), e);
            completeAction.run();
        }
    }

    private static void recordMetrics(Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Metrics exporter failed", e);
        }
    }

    private void awaitTermination(CompletableFuture<Void> result) {
        Thread t = thread;
        try {
            if (drainTimeout == null) {
                t.join();
            } else {
                t.join(Math.max(1L, drainTimeout.toMillis()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminated = true;
            result.completeExceptionally(new JoinException("Interrupted while joining " + name(), e));
            return;
        }

        if (t.isAlive()) {
            terminated = true;
            abandoned = true;
            t.interrupt();
            result.completeExceptionally(new JoinException(
                    "Connection actor " + name() + " did not terminate within " + drainTimeout));
            return;
        }

        Throwable failure = closeFailure;
        if (failure != null) {
            result.completeExceptionally(new JoinException(
                    "Connection actor " + name() + " failed to close its connection", failure));
        } else {
            result.complete(null);
        }
    }

    private ClosedException closed() {
        return new ClosedException("Connection actor " + name() + " is closed");
    }
}
