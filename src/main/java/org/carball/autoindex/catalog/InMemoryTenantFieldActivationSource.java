package org.carball.autoindex.catalog;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.model.tenant.ActiveField;
import org.carball.autoindex.model.tenant.FieldActivationChange;
import org.carball.autoindex.model.tenant.TenantFieldActivation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory activation store with a versioned change log. Every enable or
 * disable that actually changes state bumps the tenant's version and appends
 * one {@link FieldActivationChange}.
 */
@Slf4j
public class InMemoryTenantFieldActivationSource implements TenantFieldActivationSource {

    private final Clock clock;
    private final Map<String, TenantFieldActivation> activations = new HashMap<>();
    private final List<FieldActivationChange> changeLog = new ArrayList<>();

    public InMemoryTenantFieldActivationSource(Clock clock) {
        this.clock = clock;
    }

    public synchronized void enableField(String tenantId, String table, String field) {
        change(tenantId, table, field, true);
    }

    public synchronized void disableField(String tenantId, String table, String field) {
        change(tenantId, table, field, false);
    }

    @Override
    public synchronized TenantFieldActivation activationFor(String tenantId) {
        return activations.getOrDefault(tenantId, TenantFieldActivation.none(tenantId));
    }

    public synchronized List<FieldActivationChange> changesSince(String tenantId, long version) {
        return changeLog.stream()
                .filter(c -> c.tenantId().equals(tenantId) && c.version() > version)
                .toList();
    }

    private void change(String tenantId, String table, String field, boolean enabled) {
        TenantFieldActivation current = activationFor(tenantId);
        ActiveField activeField = new ActiveField(table, field);
        Set<ActiveField> fields = new HashSet<>(current.activeFields());

        boolean changed = enabled ? fields.add(activeField) : fields.remove(activeField);
        if (!changed) {
            return;
        }

        long version = current.version() + 1;
        activations.put(tenantId, new TenantFieldActivation(tenantId, fields, version));
        changeLog.add(new FieldActivationChange(tenantId, activeField.table(), activeField.field(),
                enabled, version, clock.instant()));
        log.info("Tenant {} {} field {}.{} (version {})", tenantId, enabled ? "enabled" : "disabled",
                activeField.table(), activeField.field(), version);
    }
}
