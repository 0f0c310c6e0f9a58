package org.carball.autoindex.model.audit;

import org.carball.autoindex.model.decision.Decision;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit record. {@code appliedAt} is set only for {@link MutationOutcome#APPLIED}.
 */
public record MutationLogEntry(UUID entryId,
                               Decision decision,
                               MutationOutcome outcome,
                               String errorDetail,
                               Instant appliedAt,
                               Instant recordedAt) {

    public MutationLogEntry {
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(recordedAt, "recordedAt");
        if (outcome != MutationOutcome.APPLIED && appliedAt != null) {
            throw new IllegalArgumentException("appliedAt is only valid for APPLIED entries, got " + outcome);
        }
    }

    public UUID decisionId() {
        return decision.decisionId();
    }
}
