/**
 * Engine-neutral JDBC helpers: a {@link io.litebridge.jdbc.DataSourceConnectionFactory}
 * for running actors over any {@link javax.sql.DataSource}, and
 * {@link io.litebridge.jdbc.JdbcTemplate} for concise callbacks.
 */
package io.litebridge.jdbc;
