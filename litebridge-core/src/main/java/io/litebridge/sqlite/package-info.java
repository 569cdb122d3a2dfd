/**
 * SQLite connection opening through {@code org.xerial:sqlite-jdbc}.
 */
package io.litebridge.sqlite;
