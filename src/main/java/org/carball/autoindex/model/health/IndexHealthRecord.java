package org.carball.autoindex.model.health;

import java.time.Instant;

/**
 * Latest observed condition of one index. {@code usageCount} is the cumulative
 * scan counter; {@code lastUsedAt} is when the counter was last seen to move.
 */
public record IndexHealthRecord(String indexName,
                                String table,
                                double bloatRatio,
                                long sizeBytes,
                                long usageCount,
                                Instant lastUsedAt,
                                Instant observedAt) {
}
