package io.litebridge;

import io.litebridge.pool.PoolDispatcher;
import io.litebridge.util.Futures;

import java.util.concurrent.CompletableFuture;

/**
 * Builder for {@link Pool}. Obtain one via {@link Pool#builder()}.
 */
public final class PoolBuilder extends AbstractBuilder<PoolBuilder> {

    int numConns = Runtime.getRuntime().availableProcessors();

    PoolBuilder() {}

    /**
     * Sets the number of connections: one writer plus {@code numConns - 1} readers.
     *
     * <p>Optional. Defaults to the number of available processors. Values below 1 make
     * {@link #open()} fail with {@link OpenException}.
     *
     * @param numConns number of connections
     * @return this builder
     */
    public PoolBuilder numConns(int numConns) {
        this.numConns = numConns;
        return this;
    }

    /**
     * Opens every connection of the pool concurrently. The future fails with
     * {@link OpenException} if any of them fails; the others are closed first.
     *
     * @return a future for the open pool
     * @throws IllegalStateException if this builder was already used or its settings conflict
     */
    public CompletableFuture<Pool> open() {
        markBuilt();
        return PoolDispatcher.open(resolveConnectionFactory(), numConns, actorOptions("pool"))
                .thenApply(Pool::new);
    }

    /**
     * Blocking variant of {@link #open()}.
     *
     * @return the open pool
     * @throws OpenException if any connection cannot be opened
     */
    public Pool openBlocking() {
        return Futures.await(open());
    }
}
