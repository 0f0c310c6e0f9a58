package org.carball.autoindex.model.telemetry;

import java.util.Comparator;
import java.util.Objects;

/**
 * Aggregation and de-duplication key: one field of one table for one tenant.
 */
public record FieldKey(String tenantId, String table, String field) implements Comparable<FieldKey> {

    private static final Comparator<FieldKey> ORDER = Comparator
            .comparing(FieldKey::tenantId)
            .thenComparing(FieldKey::table)
            .thenComparing(FieldKey::field);

    public FieldKey {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(field, "field");
    }

    @Override
    public int compareTo(FieldKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return tenantId + "/" + table + "." + field;
    }
}
