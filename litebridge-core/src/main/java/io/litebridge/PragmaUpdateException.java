package io.litebridge;

import java.util.Objects;

/**
 * Thrown at open time when the engine answers a pragma update with a value other than
 * the one requested (e.g. {@code journal_mode=wal} on an in-memory database).
 */
public final class PragmaUpdateException extends OpenException {
    private final String pragma;
    private final String expected;
    private final String actual;

    public PragmaUpdateException(String pragma, String expected, String actual) {
        super("updating pragma " + pragma + ": expected '" + expected + "', got '" + actual + "'");
        this.pragma = Objects.requireNonNull(pragma, "pragma");
        this.expected = Objects.requireNonNull(expected, "expected");
        this.actual = actual;
    }

    public String pragma() {
        return pragma;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
