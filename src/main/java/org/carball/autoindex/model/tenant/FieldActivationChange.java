package org.carball.autoindex.model.tenant;

import java.time.Instant;

public record FieldActivationChange(String tenantId,
                                    String table,
                                    String field,
                                    boolean enabled,
                                    long version,
                                    Instant changedAt) {
}
