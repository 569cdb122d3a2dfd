package io.litebridge;

/**
 * Reports a connection callback that terminated abnormally: it threw an unchecked
 * exception or an {@link Error} instead of returning. The original throwable is the cause.
 *
 * <p>The connection actor survives the failure and keeps serving later jobs.
 */
public final class PanicException extends LiteBridgeException {

    public PanicException(String message, Throwable cause) {
        super(message, cause);
    }
}
