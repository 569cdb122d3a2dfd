package io.litebridge.jdbc;

import io.litebridge.spi.ConnectionFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionFactory} backed by a {@link DataSource}.
 * Delegates directly to {@link DataSource#getConnection()}.
 *
 * <p>Lets any JDBC engine sit behind the actors. The data source must hand out
 * independent physical connections; a pooling data source would have its connections
 * held for the lifetime of each actor.
 *
 * @see ConnectionFactory
 */
public final class DataSourceConnectionFactory implements ConnectionFactory {
    private final DataSource dataSource;

    public DataSourceConnectionFactory(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Connection open() throws SQLException {
        return dataSource.getConnection();
    }
}
