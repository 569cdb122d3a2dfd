package io.litebridge;

/**
 * Base type of every error raised by litebridge.
 *
 * <p>Asynchronous operations deliver these by completing their future exceptionally;
 * the blocking variants rethrow them as-is.
 */
public abstract class LiteBridgeException extends RuntimeException {

    protected LiteBridgeException(String message) {
        super(message);
    }

    protected LiteBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
