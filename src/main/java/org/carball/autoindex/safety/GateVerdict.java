package org.carball.autoindex.safety;

import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.Decision;

/**
 * Result of passing a CREATE through the gate. An admitted verdict carries the
 * key's lease, which the caller must close once the build is recorded. A
 * vetoed verdict carries the terminal outcome and the decision to log, which
 * may have been rewritten.
 */
public record GateVerdict(Decision decision, MutationOutcome outcome, String reason, InFlightRegistry.Lease lease) {

    public static GateVerdict admitted(Decision decision, InFlightRegistry.Lease lease) {
        return new GateVerdict(decision, null, null, lease);
    }

    public static GateVerdict vetoed(Decision decision, MutationOutcome outcome, String reason) {
        return new GateVerdict(decision, outcome, reason, null);
    }

    public boolean isAdmitted() {
        return outcome == null;
    }
}
