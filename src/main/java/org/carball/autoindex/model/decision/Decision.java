package org.carball.autoindex.model.decision;

import org.carball.autoindex.model.telemetry.FieldKey;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of evaluating one candidate. Immutable; gate rewrites produce a copy
 * that keeps the decision id so log entries stay linked.
 */
public record Decision(UUID decisionId,
                       IndexCandidate candidate,
                       DecisionAction action,
                       double score,
                       double confidence,
                       double estimatedBenefit,
                       String reasonText,
                       long queryCount,
                       Instant windowStart,
                       Instant windowEnd,
                       Instant evaluatedAt) {

    public Decision {
        Objects.requireNonNull(decisionId, "decisionId");
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(reasonText, "reasonText");
    }

    public FieldKey key() {
        return candidate.key();
    }

    public String tenantId() {
        return candidate.tenantId();
    }

    public Decision withAction(DecisionAction newAction, String newReason) {
        return new Decision(decisionId, candidate, newAction, score, confidence, estimatedBenefit,
                newReason, queryCount, windowStart, windowEnd, evaluatedAt);
    }
}
