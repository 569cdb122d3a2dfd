package io.litebridge.pool;

import io.litebridge.ConnectionCallback;
import io.litebridge.JoinException;
import io.litebridge.OpenException;
import io.litebridge.actor.ActorOptions;
import io.litebridge.actor.ConnectionActor;
import io.litebridge.spi.ConnectionFactory;
import io.litebridge.util.Futures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes connection callbacks over a fixed set of {@link ConnectionActor}s: one writer
 * and the remaining readers, all opened against the same storage with the same settings.
 *
 * <p>{@link AccessMode#WRITE WRITE} jobs always go to the writer, so writes are totally
 * ordered and never contend for the engine's write lock. {@link AccessMode#READ READ}
 * jobs rotate round-robin over the readers and may run concurrently with each other
 * and with the writer. A pool of one actor uses it for both roles. No priority is
 * applied between reads and writes: each actor runs its own queue in arrival order.
 *
 * <p>The dispatcher adds no synchronization of its own for write visibility; whether a
 * reader sees a just-committed write is decided by the engine's journal mode.
 *
 * <p>This class is thread-safe. Create instances via {@link #open}.
 */
public final class PoolDispatcher {
    private static final Logger logger = Logger.getLogger(PoolDispatcher.class.getName());

    private final ConnectionActor writer;
    private final List<ConnectionActor> readers;
    private final List<ConnectionActor> actors;
    private final AtomicInteger cursor = new AtomicInteger(0);
    private final AtomicReference<CompletableFuture<Void>> closeFuture = new AtomicReference<>();

    private PoolDispatcher(List<ConnectionActor> actors) {
        this.actors = Collections.unmodifiableList(new ArrayList<>(actors));
        this.writer = actors.get(0);
        this.readers = actors.size() == 1
                ? List.of(writer)
                : Collections.unmodifiableList(new ArrayList<>(actors.subList(1, actors.size())));
    }

    /**
     * Opens {@code poolSize} actors concurrently. The first becomes the writer.
     *
     * <p>Fails with {@link OpenException} if {@code poolSize < 1} or any actor fails to
     * open. On a partial failure the actors that did open are closed before the returned
     * future fails, so no thread outlives the failed open.
     *
     * @param factory  opens each actor's connection
     * @param poolSize number of actors, at least 1
     * @param options  settings applied to every actor
     * @return a future for the running dispatcher
     */
    public static CompletableFuture<PoolDispatcher> open(ConnectionFactory factory, int poolSize,
                                                         ActorOptions options) {
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(options, "options");
        if (poolSize < 1) {
            return CompletableFuture.failedFuture(new OpenException("poolSize must be >= 1, was " + poolSize));
        }

        List<CompletableFuture<ConnectionActor>> opens = new ArrayList<>(poolSize);
        for (int i = 0; i < poolSize; i++) {
            opens.add(ConnectionActor.open(factory, options));
        }
        return CompletableFuture.allOf(opens.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> opens)
                .thenCompose(PoolDispatcher::assemble);
    }

    private static CompletableFuture<PoolDispatcher> assemble(List<CompletableFuture<ConnectionActor>> opens) {
        List<ConnectionActor> opened = new ArrayList<>(opens.size());
        OpenException failure = null;
        for (CompletableFuture<ConnectionActor> open : opens) {
            Throwable error = Futures.failureOf(open);
            if (error == null) {
                opened.add(open.join());
            } else if (failure == null) {
                failure = error instanceof OpenException oe
                        ? oe : new OpenException("Failed to open pool connection", error);
            } else {
                failure.addSuppressed(error);
            }
        }
        if (failure == null) {
            return CompletableFuture.completedFuture(new PoolDispatcher(opened));
        }

        OpenException reported = failure;
        logger.log(Level.WARNING, "Pool open failed; closing " + opened.size() + " opened connections", reported);
        CompletableFuture<PoolDispatcher> failed = new CompletableFuture<>();
        closeAll(opened).whenComplete((v, closeError) -> {
            if (closeError != null) {
                reported.addSuppressed(Futures.cause(closeError));
            }
            failed.completeExceptionally(reported);
        });
        return failed;
    }

    /**
     * Routes a callback by access mode.
     *
     * @param mode     read or write
     * @param callback the work to run
     * @param <T>      result type
     * @return the job's result
     */
    public <T> CompletableFuture<T> submit(AccessMode mode, ConnectionCallback<T> callback) {
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case READ -> nextReader().submit(callback);
            case WRITE -> writer.submit(callback);
        };
    }

    public <T> CompletableFuture<T> submitRead(ConnectionCallback<T> callback) {
        return submit(AccessMode.READ, callback);
    }

    public <T> CompletableFuture<T> submitWrite(ConnectionCallback<T> callback) {
        return submit(AccessMode.WRITE, callback);
    }

    /**
     * Runs the callback once on every actor, writer first. Useful for per-connection
     * session settings.
     *
     * <p>The returned future fails if any of the runs fails.
     *
     * @param callback the work to run on each connection
     * @param <T>      result type
     * @return the results, in actor order
     */
    public <T> CompletableFuture<List<T>> submitEach(ConnectionCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        List<CompletableFuture<T>> results = new ArrayList<>(actors.size());
        for (ConnectionActor actor : actors) {
            results.add(actor.submit(callback));
        }
        return CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0]))
                .thenApply(v -> results.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Closes every actor and completes once all have terminated.
     *
     * <p>Safe to call repeatedly and when some actors already failed. If any actor fails
     * to terminate cleanly the future fails with a {@link JoinException} whose cause is the
     * first actor failure, the rest attached as suppressed exceptions.
     *
     * @return a future completing when all actor threads have exited
     */
    public CompletableFuture<Void> closeAsync() {
        CompletableFuture<Void> existing = closeFuture.get();
        if (existing == null) {
            CompletableFuture<Void> created = closeAll(actors);
            existing = closeFuture.compareAndSet(null, created) ? created : closeFuture.get();
        }
        return existing.copy();
    }

    static CompletableFuture<Void> closeAll(List<ConnectionActor> actors) {
        List<CompletableFuture<Void>> closes = new ArrayList<>(actors.size());
        for (ConnectionActor actor : actors) {
            closes.add(actor.closeAsync());
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture.allOf(closes.toArray(new CompletableFuture<?>[0])).whenComplete((v, ignored) -> {
            // Actor close outcomes are memoized and shared, so they are attached, never mutated.
            JoinException failure = null;
            for (CompletableFuture<Void> close : closes) {
                Throwable error = Futures.failureOf(close);
                if (error == null) {
                    continue;
                }
                if (failure == null) {
                    failure = new JoinException("Pool close failed", error);
                } else {
                    failure.addSuppressed(error);
                }
            }
            if (failure == null) {
                done.complete(null);
            } else {
                done.completeExceptionally(failure);
            }
        });
        return done;
    }

    ConnectionActor nextReader() {
        if (readers.size() == 1) {
            return readers.get(0);
        }
        // Mask sign bit to stay non-negative after int overflow
        int n = cursor.getAndIncrement() & 0x7FFFFFFF;
        return readers.get(n % readers.size());
    }

    public ConnectionActor writer() {
        return writer;
    }

    /**
     * Returns the reader actors. For a pool of one this is the writer alone.
     *
     * @return unmodifiable list of readers
     */
    public List<ConnectionActor> readers() {
        return readers;
    }

    /**
     * Returns every distinct actor, writer first.
     *
     * @return unmodifiable list of actors
     */
    public List<ConnectionActor> actors() {
        return actors;
    }

    public int size() {
        return actors.size();
    }

    public boolean isClosed() {
        for (ConnectionActor actor : actors) {
            if (!actor.isClosed()) {
                return false;
            }
        }
        return true;
    }
}
