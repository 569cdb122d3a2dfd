package io.litebridge;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work executed on a connection actor's thread.
 *
 * <p>The connection is only valid for the duration of {@link #execute}: do not store it,
 * hand it to another thread or close it. Calling a blocking litebridge method that
 * targets the same actor from inside a callback deadlocks.
 *
 * @param <T> the result type delivered to the caller
 */
@FunctionalInterface
public interface ConnectionCallback<T> {

    /**
     * Runs against the actor's connection.
     *
     * @param conn the connection, exclusively owned for the duration of the call
     * @return the result to deliver to the caller
     * @throws SQLException to fail the submission with {@link ExecutionFailedException}
     */
    T execute(Connection conn) throws SQLException;
}
