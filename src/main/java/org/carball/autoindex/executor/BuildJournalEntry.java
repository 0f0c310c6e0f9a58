package org.carball.autoindex.executor;

import org.carball.autoindex.model.decision.Decision;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable note that a build was started. An entry outlives a crash, which is
 * how the health pass finds builds that never reported back.
 */
public record BuildJournalEntry(Decision decision,
                                IndexDefinition definition,
                                Status status,
                                Instant startedAt,
                                String detail) {

    public enum Status {
        /** DDL issued and not yet acknowledged. */
        BUILDING,
        /** The build failed or timed out and may have left an invalid index behind. */
        NEEDS_CLEANUP
    }

    public UUID decisionId() {
        return decision.decisionId();
    }

    public BuildJournalEntry withStatus(Status newStatus, String newDetail) {
        return new BuildJournalEntry(decision, definition, newStatus, startedAt, newDetail);
    }
}
