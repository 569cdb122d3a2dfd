package io.litebridge.util;

import io.litebridge.ClosedException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuturesTest {

    @Test
    void awaitReturnsValue() {
        assertEquals("ok", Futures.await(CompletableFuture.completedFuture("ok")));
    }

    @Test
    void awaitRethrowsUncheckedFailureUnwrapped() {
        ClosedException closed = new ClosedException("closed");

        ClosedException thrown = assertThrows(ClosedException.class,
                () -> Futures.await(CompletableFuture.failedFuture(closed)));

        assertSame(closed, thrown);
    }

    @Test
    void awaitUnwrapsCompositionLayers() {
        ClosedException closed = new ClosedException("closed");
        CompletableFuture<String> composed = CompletableFuture.<String>failedFuture(closed)
                .thenApply(s -> s + "!")
                .thenCompose(CompletableFuture::completedFuture);

        assertSame(closed, assertThrows(ClosedException.class, () -> Futures.await(composed)));
    }

    @Test
    void awaitWrapsCheckedFailure() {
        IOException io = new IOException("disk");

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> Futures.await(CompletableFuture.failedFuture(io)));

        assertSame(io, thrown.getCause());
    }

    @Test
    void awaitRethrowsErrors() {
        assertThrows(AssertionError.class,
                () -> Futures.await(CompletableFuture.failedFuture(new AssertionError("bad"))));
    }

    @Test
    void awaitOfCancelledFutureThrowsCancellation() {
        CompletableFuture<String> future = new CompletableFuture<>();
        future.cancel(false);

        assertThrows(CancellationException.class, () -> Futures.await(future));
    }

    @Test
    void awaitRestoresInterruptFlag() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(IllegalStateException.class, () -> Futures.await(new CompletableFuture<>()));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void failureOfReportsUnwrappedCause() {
        ClosedException closed = new ClosedException("closed");

        assertNull(Futures.failureOf(CompletableFuture.completedFuture(1)));
        assertSame(closed, Futures.failureOf(CompletableFuture.failedFuture(closed)));
        CompletableFuture<Integer> cancelled = new CompletableFuture<>();
        cancelled.cancel(false);
        assertInstanceOf(CancellationException.class, Futures.failureOf(cancelled));
    }
}
