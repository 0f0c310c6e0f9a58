package org.carball.autoindex.safety;

import org.carball.autoindex.model.decision.Decision;

import java.time.Instant;

/**
 * A CREATE decision held for an operator. The decision is the original one,
 * before the gate rewrote it to DEFER.
 */
public record PendingApproval(Decision decision, Instant requestedAt) {
}
