package io.litebridge.actor;

/**
 * Message carried by an actor queue: a {@link Job}, or the {@link Shutdown} marker
 * that ends the receive loop once everything queued ahead of it has run.
 */
sealed interface Command permits Job, Command.Shutdown {

    enum Shutdown implements Command {
        INSTANCE
    }
}
