package org.carball.autoindex.model.stats;

import org.carball.autoindex.model.telemetry.FieldKey;
import org.carball.autoindex.model.telemetry.PredicateKind;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-key aggregate over one closed event-time window.
 */
public record Statistics(String tenantId,
                         String table,
                         String field,
                         Instant windowStart,
                         Instant windowEnd,
                         long queryCount,
                         double avgDurationMs,
                         double p95DurationMs,
                         double p99DurationMs,
                         Set<PredicateKind> predicateKinds) {

    public Statistics {
        EnumSet<PredicateKind> kinds = EnumSet.noneOf(PredicateKind.class);
        if (predicateKinds != null) {
            kinds.addAll(predicateKinds);
        }
        predicateKinds = Collections.unmodifiableSet(kinds);
    }

    public FieldKey key() {
        return new FieldKey(tenantId, table, field);
    }

    /**
     * True when the numbers cannot support a cost estimate at all.
     */
    public boolean isDegenerate() {
        return queryCount <= 0
                || !Double.isFinite(avgDurationMs) || avgDurationMs < 0
                || !Double.isFinite(p95DurationMs) || p95DurationMs < 0;
    }
}
