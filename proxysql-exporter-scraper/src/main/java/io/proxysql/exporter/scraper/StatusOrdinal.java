package io.proxysql.exporter.scraper;

import java.util.Locale;

/**
 * Numeric encoding of the backend server status, ordered by severity.
 */
public enum StatusOrdinal {
    ONLINE(1),
    SHUNNED(2),
    OFFLINE_SOFT(3),
    OFFLINE_HARD(4);

    private final int ordinal;

    StatusOrdinal(int ordinal) {
        this.ordinal = ordinal;
    }

    public int value() {
        return ordinal;
    }

    public static StatusOrdinal of(String field, String status) throws UnknownStatusException {
        if (status == null) {
            throw new UnknownStatusException(field, null);
        }
        for (StatusOrdinal s : values()) {
            if (s.name().equals(status.trim().toUpperCase(Locale.ROOT))) {
                return s;
            }
        }
        throw new UnknownStatusException(field, status);
    }
}
