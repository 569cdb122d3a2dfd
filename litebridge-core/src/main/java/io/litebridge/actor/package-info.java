/**
 * Dedicated-thread connection actors.
 *
 * <p>A {@link io.litebridge.actor.ConnectionActor} owns one JDBC connection and the
 * only thread allowed to use it. Submitted callbacks are queued as jobs, run strictly
 * one at a time in arrival order, and answered through a
 * {@link java.util.concurrent.CompletableFuture} per job.
 */
package io.litebridge.actor;
