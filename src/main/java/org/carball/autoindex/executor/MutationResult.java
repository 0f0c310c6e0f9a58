package org.carball.autoindex.executor;

import org.carball.autoindex.model.audit.MutationOutcome;

import java.time.Instant;

public record MutationResult(MutationOutcome outcome, String detail, Instant appliedAt, int attempts) {

    public static MutationResult applied(Instant appliedAt, int attempts) {
        return new MutationResult(MutationOutcome.APPLIED, null, appliedAt, attempts);
    }

    public static MutationResult skipped(String detail) {
        return new MutationResult(MutationOutcome.SKIPPED, detail, null, 0);
    }

    public static MutationResult failed(String detail, int attempts) {
        return new MutationResult(MutationOutcome.FAILED, detail, null, attempts);
    }
}
