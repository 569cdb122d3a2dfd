package io.litebridge;

/**
 * Thrown when work is submitted to a connection that is closing or closed, or when a
 * queued job is cancelled because its connection shut down before reaching it.
 */
public final class ClosedException extends LiteBridgeException {

    public ClosedException(String message) {
        super(message);
    }
}
