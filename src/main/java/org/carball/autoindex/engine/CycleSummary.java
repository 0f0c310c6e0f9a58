package org.carball.autoindex.engine;

import java.time.Instant;
import java.util.UUID;

/**
 * Counts for one evaluation cycle. {@code decisions} equals the sum of the
 * outcome counts; ineligible keys produced no decision and are counted apart.
 */
public record CycleSummary(UUID cycleId,
                           Instant startedAt,
                           Instant finishedAt,
                           int recordsIngested,
                           long droppedLate,
                           long droppedMalformed,
                           int decisions,
                           int created,
                           int skipped,
                           int failed,
                           int rateLimited,
                           int pendingApproval,
                           int bypassed,
                           int ineligible) {

    public int deferred() {
        return rateLimited + pendingApproval;
    }

    @Override
    public String toString() {
        return String.format("Cycle %s: %d records, %d decisions (%d created, %d skipped, %d failed, %d deferred, %d bypassed), %d ineligible, %d late, %d malformed",
                cycleId, recordsIngested, decisions, created, skipped, failed, deferred(), bypassed,
                ineligible, droppedLate, droppedMalformed);
    }
}
