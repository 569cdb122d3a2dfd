package io.litebridge;

/**
 * Thrown by close when an actor thread did not terminate cleanly: its connection failed
 * to close, the drain timeout elapsed, or the wait was interrupted.
 *
 * <p>The actor is considered terminated regardless; closing it again is a no-op that
 * reports the same outcome.
 */
public final class JoinException extends LiteBridgeException {

    public JoinException(String message) {
        super(message);
    }

    public JoinException(String message, Throwable cause) {
        super(message, cause);
    }
}
