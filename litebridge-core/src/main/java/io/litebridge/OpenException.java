package io.litebridge;

/**
 * Thrown when a connection actor cannot be started: the engine failed to open or create
 * its storage, the actor thread could not be spawned, or the pool size is invalid.
 *
 * <p>No actor thread is left running when this is reported.
 */
public class OpenException extends LiteBridgeException {

    public OpenException(String message) {
        super(message);
    }

    public OpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
