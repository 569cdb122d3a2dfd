package io.litebridge;

import io.litebridge.actor.ConnectionActor;
import io.litebridge.util.Futures;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A single SQLite connection usable from asynchronous code.
 *
 * <p>The connection lives on a dedicated thread; {@link #conn} queues a callback there
 * and returns a future for its result. Callbacks run one at a time, in submission order.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Client client = Client.builder()
 *     .path(Path.of("app.db"))
 *     .journalMode(JournalMode.WAL)
 *     .openBlocking();
 *
 * client.conn(conn -> JdbcTemplate.update(conn,
 *         "INSERT INTO users (name) VALUES (?)", "ann"))
 *     .thenAccept(rows -> log(rows));
 *
 * client.close();
 * }</pre>
 *
 * @see Pool
 */
public final class Client implements AutoCloseable {
    private final ConnectionActor actor;

    Client(ConnectionActor actor) {
        this.actor = Objects.requireNonNull(actor, "actor");
    }

    public static ClientBuilder builder() {
        return new ClientBuilder();
    }

    /**
     * Runs a callback on the connection.
     *
     * @param callback the work to run
     * @param <T>      result type
     * @return the callback's result; fails with {@link ExecutionFailedException},
     *     {@link PanicException} or {@link ClosedException}
     */
    public <T> CompletableFuture<T> conn(ConnectionCallback<T> callback) {
        return actor.submit(callback);
    }

    /**
     * Blocking variant of {@link #conn}. Must not be called from inside a callback.
     *
     * @param callback the work to run
     * @param <T>      result type
     * @return the callback's result
     */
    public <T> T connBlocking(ConnectionCallback<T> callback) {
        return Futures.await(conn(callback));
    }

    /**
     * Stops accepting work, lets queued callbacks finish, then closes the connection.
     * Idempotent.
     *
     * @return a future completing when the connection thread has exited
     */
    public CompletableFuture<Void> closeAsync() {
        return actor.closeAsync();
    }

    /**
     * Blocking variant of {@link #closeAsync()}.
     *
     * @throws JoinException if the connection thread did not terminate cleanly
     */
    @Override
    public void close() {
        Futures.await(closeAsync());
    }

    public boolean isClosed() {
        return actor.isClosed();
    }

    ConnectionActor actor() {
        return actor;
    }
}
