package org.carball.autoindex.health;

public record HealthPassSummary(int indexesObserved,
                                int bloated,
                                int underutilized,
                                boolean statsAvailable,
                                ReconciliationSummary reconciliation) {
}
