package io.litebridge.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the JDBC connection a connection actor owns for its whole lifetime.
 *
 * <p>Called once per actor, on the actor's own thread. The actor closes the returned
 * connection when it terminates.
 *
 * @see io.litebridge.sqlite.SqliteConnectionFactory
 * @see io.litebridge.jdbc.DataSourceConnectionFactory
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a new connection.
     *
     * @return an open connection, owned by the caller
     * @throws SQLException if the engine cannot open or create the storage
     */
    Connection open() throws SQLException;
}
