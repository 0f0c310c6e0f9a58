package org.carball.autoindex.model.audit;

public enum MutationOutcome {
    APPLIED,
    SKIPPED,
    FAILED,
    BYPASSED,
    RATE_LIMITED,
    PENDING_APPROVAL,
    REJECTED;

    /**
     * Pending approval is the only provisional outcome; it is later followed by a
     * resolution entry for the same decision.
     */
    public boolean isProvisional() {
        return this == PENDING_APPROVAL;
    }
}
