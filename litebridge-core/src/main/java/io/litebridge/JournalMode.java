package io.litebridge;

import java.util.Locale;

/**
 * SQLite journal modes, applied with {@code PRAGMA journal_mode} when a connection opens.
 */
public enum JournalMode {
    DELETE,
    TRUNCATE,
    PERSIST,
    MEMORY,
    WAL,
    OFF;

    /**
     * Returns the value as the engine reports it, e.g. {@code "wal"}.
     *
     * @return lower-case pragma value
     */
    public String pragmaValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
