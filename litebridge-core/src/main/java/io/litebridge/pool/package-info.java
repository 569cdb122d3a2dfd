/**
 * Writer/reader routing over a set of connection actors.
 *
 * @see io.litebridge.pool.PoolDispatcher
 */
package io.litebridge.pool;
