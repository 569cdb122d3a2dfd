package io.litebridge.sqlite;

import io.litebridge.JournalMode;
import io.litebridge.OpenFlag;
import io.litebridge.PragmaUpdateException;
import io.litebridge.jdbc.JdbcTemplate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteConnectionFactoryTest {

    @TempDir
    Path dir;

    @Test
    void inMemoryUrl() {
        assertEquals("jdbc:sqlite::memory:", SqliteConnectionFactory.inMemory().url());
    }

    @Test
    void fileUrl() {
        Path db = dir.resolve("a.db");

        SqliteConnectionFactory factory = new SqliteConnectionFactory(db, JournalMode.TRUNCATE, Set.of(), List.of());

        assertEquals("jdbc:sqlite:" + db, factory.url());
        assertEquals(db, factory.path());
        assertEquals(JournalMode.TRUNCATE, factory.journalMode());
    }

    @Test
    void noFlagsLeavesDriverDefault() {
        assertNull(SqliteConnectionFactory.inMemory().driverProperties().getProperty("open_mode"));
    }

    @Test
    void flagsAreForwardedAsBitmask() {
        SqliteConnectionFactory factory = new SqliteConnectionFactory(dir.resolve("a.db"), null,
                EnumSet.of(OpenFlag.READ_WRITE, OpenFlag.CREATE, OpenFlag.NO_MUTEX), List.of());

        assertEquals(Integer.toString(0x2 | 0x4 | 0x8000),
                factory.driverProperties().getProperty(SqliteConnectionFactory.OPEN_MODE_PROPERTY));
    }

    @Test
    void appliesJournalMode() throws SQLException {
        SqliteConnectionFactory factory = new SqliteConnectionFactory(
                dir.resolve("wal.db"), JournalMode.WAL, Set.of(), List.of());

        try (Connection conn = factory.open()) {
            assertEquals("wal", JdbcTemplate.queryString(conn, "PRAGMA journal_mode"));
        }
    }

    @Test
    void journalModeMismatchThrowsPragmaUpdate() {
        SqliteConnectionFactory factory = new SqliteConnectionFactory(null, JournalMode.WAL, Set.of(), List.of());

        PragmaUpdateException e = assertThrows(PragmaUpdateException.class, factory::open);

        assertEquals("updating pragma journal_mode: expected 'wal', got 'memory'", e.getMessage());
    }

    @Test
    void failingPragmaFailsOpen() {
        SqliteConnectionFactory factory = new SqliteConnectionFactory(
                dir.resolve("p.db"), null, Set.of(), List.of("PRAGMA user_version = 3", "NOT SQL"));

        assertThrows(SQLException.class, factory::open);
    }

    @Test
    void separateInMemoryDatabasePerConnection() throws SQLException {
        SqliteConnectionFactory factory = SqliteConnectionFactory.inMemory();

        try (Connection a = factory.open(); Connection b = factory.open()) {
            JdbcTemplate.execute(a, "CREATE TABLE only_in_a (id INTEGER)");
            assertThrows(SQLException.class, () -> JdbcTemplate.queryString(b, "SELECT COUNT(*) FROM only_in_a"));
        }
    }

    @Test
    void settingsAreCopied() {
        EnumSet<OpenFlag> flags = EnumSet.of(OpenFlag.READ_ONLY);
        SqliteConnectionFactory factory = new SqliteConnectionFactory(null, null, flags, List.of());
        flags.add(OpenFlag.CREATE);

        assertEquals(Set.of(OpenFlag.READ_ONLY), factory.flags());
        assertTrue(factory.pragmas().isEmpty());
        assertFalse(factory.flags().contains(OpenFlag.CREATE));
    }
}
