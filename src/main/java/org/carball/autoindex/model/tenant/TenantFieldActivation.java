package org.carball.autoindex.model.tenant;

import java.util.Set;

/**
 * Snapshot of which fields a tenant has enabled for querying.
 */
public record TenantFieldActivation(String tenantId, Set<ActiveField> activeFields, long version) {

    public TenantFieldActivation {
        activeFields = activeFields == null ? Set.of() : Set.copyOf(activeFields);
    }

    public static TenantFieldActivation none(String tenantId) {
        return new TenantFieldActivation(tenantId, Set.of(), 0L);
    }

    public boolean isActive(String table, String field) {
        if (table == null || field == null) {
            return false;
        }
        return activeFields.contains(new ActiveField(table, field));
    }
}
