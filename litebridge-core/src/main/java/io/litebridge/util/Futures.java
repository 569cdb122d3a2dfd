package io.litebridge.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for the blocking facade methods.
 */
public final class Futures {

    /**
     * Waits for a future and rethrows its failure unwrapped.
     *
     * <p>Unchecked causes (every litebridge error is one) are rethrown as-is; anything
     * else is wrapped in a {@link CompletionException}. An interrupted wait restores the
     * interrupt flag and throws {@link IllegalStateException}; the awaited job keeps
     * running on its actor.
     *
     * @param future the future to wait for
     * @param <T>    result type
     * @return the future's value
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a connection job", e);
        }
    }

    /**
     * Strips {@link CompletionException} layers added by future composition.
     *
     * @param failure the failure as seen by a dependent stage
     * @return the underlying cause
     */
    public static Throwable cause(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Returns the failure of a completed future, or {@code null} if it succeeded.
     * Must only be called once the future is done.
     *
     * @param future a completed future
     * @return the unwrapped failure, or {@code null}
     */
    public static Throwable failureOf(CompletableFuture<?> future) {
        try {
            future.join();
            return null;
        } catch (CompletionException | CancellationException e) {
            return cause(e);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        Throwable t = cause(cause);
        if (t instanceof RuntimeException re) {
            return re;
        }
        if (t instanceof Error err) {
            throw err;
        }
        return new CompletionException(t);
    }

    private Futures() {}
}
