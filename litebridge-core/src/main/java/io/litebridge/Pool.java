package io.litebridge;

import io.litebridge.pool.AccessMode;
import io.litebridge.pool.PoolDispatcher;
import io.litebridge.util.Futures;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A set of SQLite connections to one database: a single writer and several readers.
 *
 * <p>{@link #write} always runs on the writer connection, so writes never race for the
 * engine's write lock. {@link #read} rotates across the reader connections. Use
 * {@link JournalMode#WAL} to let readers proceed while the writer commits.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Pool pool = Pool.builder()
 *         .path(Path.of("app.db"))
 *         .journalMode(JournalMode.WAL)
 *         .numConns(4)
 *         .openBlocking()) {
 *
 *     pool.writeBlocking(conn -> JdbcTemplate.update(conn,
 *             "INSERT INTO users (name) VALUES (?)", "ann"));
 *
 *     CompletableFuture<List<String>> names = pool.read(conn ->
 *         JdbcTemplate.query(conn, "SELECT name FROM users", rs -> rs.getString(1)));
 * }
 * }</pre>
 *
 * @see Client
 * @see PoolDispatcher
 */
public final class Pool implements AutoCloseable {
    private final PoolDispatcher dispatcher;

    Pool(PoolDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public static PoolBuilder builder() {
        return new PoolBuilder();
    }

    /**
     * Runs a read-only callback on the next reader connection.
     *
     * @param callback the work to run
     * @param <T>      result type
     * @return the callback's result
     */
    public <T> CompletableFuture<T> read(ConnectionCallback<T> callback) {
        return dispatcher.submit(AccessMode.READ, callback);
    }

    /**
     * Runs a callback on the writer connection.
     *
     * @param callback the work to run
     * @param <T>      result type
     * @return the callback's result
     */
    public <T> CompletableFuture<T> write(ConnectionCallback<T> callback) {
        return dispatcher.submit(AccessMode.WRITE, callback);
    }

    public <T> T readBlocking(ConnectionCallback<T> callback) {
        return Futures.await(read(callback));
    }

    public <T> T writeBlocking(ConnectionCallback<T> callback) {
        return Futures.await(write(callback));
    }

    /**
     * Runs the callback on every connection of the pool, writer first.
     *
     * @param callback the work to run on each connection
     * @param <T>      result type
     * @return the results, one per connection
     */
    public <T> CompletableFuture<List<T>> connForEach(ConnectionCallback<T> callback) {
        return dispatcher.submitEach(callback);
    }

    public <T> List<T> connForEachBlocking(ConnectionCallback<T> callback) {
        return Futures.await(connForEach(callback));
    }

    public int size() {
        return dispatcher.size();
    }

    /**
     * Closes every connection once its queued callbacks have run. Idempotent.
     *
     * @return a future completing when all connection threads have exited
     */
    public CompletableFuture<Void> closeAsync() {
        return dispatcher.closeAsync();
    }

    /**
     * Blocking variant of {@link #closeAsync()}.
     *
     * @throws JoinException if a connection thread did not terminate cleanly
     */
    @Override
    public void close() {
        Futures.await(closeAsync());
    }

    public boolean isClosed() {
        return dispatcher.isClosed();
    }

    PoolDispatcher dispatcher() {
        return dispatcher;
    }
}
