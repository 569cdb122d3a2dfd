/**
 * Root API of litebridge: blocking SQLite connections driven from asynchronous code.
 *
 * <h2>Core Design</h2>
 * <p>Each connection is owned by a {@linkplain io.litebridge.actor.ConnectionActor
 * connection actor}: one dedicated thread that takes submitted
 * {@link io.litebridge.ConnectionCallback callbacks} from a FIFO queue and runs them one at
 * a time. Every submission returns a {@link java.util.concurrent.CompletableFuture} that
 * always completes, with the callback's value or with one of the
 * {@link io.litebridge.LiteBridgeException} subtypes.
 *
 * <p>A {@link io.litebridge.Client} is a single actor. A {@link io.litebridge.Pool} is one
 * writer actor plus reader actors behind a
 * {@linkplain io.litebridge.pool.PoolDispatcher dispatcher}: every write goes to the writer,
 * reads rotate across the readers.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>litebridge-core</b>: actors, pool, builders, SQLite connection factory</li>
 *   <li><b>litebridge-micrometer</b>: optional Micrometer metrics bridge</li>
 *   <li><b>litebridge-spring-boot-starter</b>: Spring Boot auto-configuration of a
 *       {@code Pool}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (Pool pool = Pool.builder()
 *         .path(Path.of("app.db"))
 *         .journalMode(JournalMode.WAL)
 *         .openBlocking()) {
 *
 *     pool.write(conn -> {
 *         JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS kv (k TEXT PRIMARY KEY, v TEXT)");
 *         return JdbcTemplate.update(conn, "INSERT INTO kv VALUES (?, ?)", "a", "1");
 *     }).join();
 *
 *     Optional<String> v = pool.read(conn -> JdbcTemplate.queryFirst(conn,
 *         "SELECT v FROM kv WHERE k = ?", rs -> rs.getString(1), "a")).join();
 * }
 * }</pre>
 *
 * @see io.litebridge.Client
 * @see io.litebridge.Pool
 * @see io.litebridge.ConnectionCallback
 */
package io.litebridge;
