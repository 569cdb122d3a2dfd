package io.litebridge;

import java.sql.SQLException;

/**
 * Wraps the {@link SQLException} a connection callback threw. The engine error is kept
 * untouched as the {@linkplain #getCause() cause}.
 */
public final class ExecutionFailedException extends LiteBridgeException {

    public ExecutionFailedException(SQLException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }

    /**
     * Returns the SQLSTATE of the wrapped engine error, possibly {@code null}.
     *
     * @return the SQL state
     */
    public String sqlState() {
        return getCause().getSQLState();
    }

    /**
     * Returns the vendor error code of the wrapped engine error.
     *
     * @return the vendor code
     */
    public int errorCode() {
        return getCause().getErrorCode();
    }
}
