package org.carball.autoindex.model.telemetry;

import java.util.Locale;

public enum PredicateKind {
    EQUALITY,
    RANGE,
    PREFIX,
    JOIN;

    /**
     * Lenient lookup used by telemetry readers. Accepts the enum name and the
     * short forms found in query_stats.query_type ("eq", "lookup", "like", ...).
     *
     * @return the matching kind, or {@code null} when the value is not recognised
     */
    public static PredicateKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "equality":
            case "eq":
            case "equals":
            case "lookup":
            case "in":
                return EQUALITY;
            case "range":
            case "between":
            case "order":
            case "sort":
                return RANGE;
            case "prefix":
            case "like":
            case "starts_with":
                return PREFIX;
            case "join":
                return JOIN;
            default:
                return null;
        }
    }
}
