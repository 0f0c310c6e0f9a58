package org.carball.autoindex.model.telemetry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One observed query execution. Records are immutable once received; the
 * aggregator decides whether a record is usable.
 */
public record QueryRecord(String tenantId,
                          String table,
                          List<String> fields,
                          PredicateKind predicateKind,
                          double durationMs,
                          Instant timestamp) {

    public QueryRecord {
        fields = fields == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static QueryRecord of(String tenantId, String table, String field,
                                 PredicateKind predicateKind, double durationMs, Instant timestamp) {
        return new QueryRecord(tenantId, table, field == null ? null : List.of(field),
                predicateKind, durationMs, timestamp);
    }

    /**
     * A record the aggregator can use: identifiers present, a predicate kind,
     * a timestamp and a finite non-negative duration.
     */
    public boolean isWellFormed() {
        if (isBlank(tenantId) || isBlank(table) || predicateKind == null || timestamp == null) {
            return false;
        }
        if (!Double.isFinite(durationMs) || durationMs < 0) {
            return false;
        }
        if (fields.isEmpty()) {
            return false;
        }
        for (String field : fields) {
            if (isBlank(field)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
