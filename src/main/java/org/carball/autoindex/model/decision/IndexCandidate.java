package org.carball.autoindex.model.decision;

import org.carball.autoindex.model.telemetry.FieldKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A proposed index. Built by the evaluator; the build cost is an estimate in
 * query-milliseconds, the same unit as the benefit.
 */
public record IndexCandidate(String tenantId,
                             String table,
                             List<String> fields,
                             double estimatedBuildCost,
                             boolean currentIndexExists) {

    public IndexCandidate {
        fields = fields == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public String leadingField() {
        return fields.isEmpty() ? null : fields.get(0);
    }

    public FieldKey key() {
        return new FieldKey(tenantId, table, leadingField());
    }
}
