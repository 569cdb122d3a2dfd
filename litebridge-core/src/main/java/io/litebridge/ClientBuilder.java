package io.litebridge;

import io.litebridge.actor.ConnectionActor;
import io.litebridge.util.Futures;

import java.util.concurrent.CompletableFuture;

/**
 * Builder for {@link Client}. Obtain one via {@link Client#builder()}.
 */
public final class ClientBuilder extends AbstractBuilder<ClientBuilder> {

    ClientBuilder() {}

    /**
     * Starts the connection actor. The future completes once its thread runs and the
     * connection is open, or fails with {@link OpenException}.
     *
     * @return a future for the open client
     * @throws IllegalStateException if this builder was already used or its settings conflict
     */
    public CompletableFuture<Client> open() {
        markBuilt();
        return ConnectionActor.open(resolveConnectionFactory(), actorOptions("conn"))
                .thenApply(Client::new);
    }

    /**
     * Blocking variant of {@link #open()}.
     *
     * @return the open client
     * @throws OpenException if the connection cannot be opened
     */
    public Client openBlocking() {
        return Futures.await(open());
    }
}
