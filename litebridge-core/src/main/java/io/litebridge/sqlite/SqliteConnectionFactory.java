package io.litebridge.sqlite;

import io.litebridge.JournalMode;
import io.litebridge.OpenFlag;
import io.litebridge.PragmaUpdateException;
import io.litebridge.jdbc.JdbcTemplate;
import io.litebridge.spi.ConnectionFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens SQLite connections through the {@code sqlite-jdbc} driver.
 *
 * <p>Settings are forwarded without interpretation: the path (or {@code :memory:}),
 * the open flags as the driver's {@code open_mode} bitmask, the journal mode through
 * {@code PRAGMA journal_mode}, then the extra pragma statements in order. A journal
 * mode the engine does not accept fails the open with {@link PragmaUpdateException}.
 *
 * <p>Every connection to {@code :memory:} is a separate database.
 */
public final class SqliteConnectionFactory implements ConnectionFactory {
    private static final Logger logger = Logger.getLogger(SqliteConnectionFactory.class.getName());

    static final String URL_PREFIX = "jdbc:sqlite:";
    static final String IN_MEMORY = ":memory:";
    static final String OPEN_MODE_PROPERTY = "open_mode";

    private final Path path;
    private final JournalMode journalMode;
    private final Set<OpenFlag> flags;
    private final List<String> pragmas;

    /**
     * @param path        database file, or {@code null} for an in-memory database
     * @param journalMode journal mode to apply, or {@code null} to keep the engine default
     * @param flags       open flags; empty keeps the driver default
     * @param pragmas     statements executed after opening
     */
    public SqliteConnectionFactory(Path path, JournalMode journalMode, Set<OpenFlag> flags, List<String> pragmas) {
        this.path = path;
        this.journalMode = journalMode;
        Objects.requireNonNull(flags, "flags");
        this.flags = flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        this.pragmas = List.copyOf(Objects.requireNonNull(pragmas, "pragmas"));
    }

    /** In-memory database with engine defaults. */
    public static SqliteConnectionFactory inMemory() {
        return new SqliteConnectionFactory(null, null, Set.of(), List.of());
    }

    public String url() {
        return URL_PREFIX + (path == null ? IN_MEMORY : path.toString());
    }

    @Override
    public Connection open() throws SQLException {
        Connection conn = DriverManager.getConnection(url(), driverProperties());
        try {
            if (journalMode != null) {
                applyJournalMode(conn);
            }
            for (String pragma : pragmas) {
                JdbcTemplate.execute(conn, pragma);
            }
            return conn;
        } catch (SQLException | RuntimeException e) {
            closeQuietly(conn, e);
            throw e;
        }
    }

    Properties driverProperties() {
        Properties props = new Properties();
        if (!flags.isEmpty()) {
            props.setProperty(OPEN_MODE_PROPERTY, Integer.toString(OpenFlag.toMask(flags)));
        }
        return props;
    }

    private void applyJournalMode(Connection conn) throws SQLException {
        String expected = journalMode.pragmaValue();
        String actual = JdbcTemplate.queryString(conn, "PRAGMA journal_mode = " + expected);
        if (actual == null || !expected.equalsIgnoreCase(actual)) {
            throw new PragmaUpdateException("journal_mode", expected, actual);
        }
    }

    private static void closeQuietly(Connection conn, Exception primary) {
        try {
            conn.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
            logger.log(Level.WARNING, "Failed to close SQLite connection after a failed open", e);
        }
    }

    public Path path() {
        return path;
    }

    public JournalMode journalMode() {
        return journalMode;
    }

    public Set<OpenFlag> flags() {
        return flags;
    }

    public List<String> pragmas() {
        return new ArrayList<>(pragmas);
    }
}
