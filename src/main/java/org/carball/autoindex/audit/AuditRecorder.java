package org.carball.autoindex.audit;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.model.audit.MutationLogEntry;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.Decision;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes exactly one mutation log entry per decision outcome. The only
 * decision that may be recorded twice is one held for approval: its
 * PENDING_APPROVAL entry is followed by a single resolution entry.
 * Every entry is mirrored to the application log.
 * <p>
 * In memory the recorder keeps only the decisions still awaiting approval and
 * a bounded window of recently recorded ids. Anything older is answered by the
 * store.
 */
@Slf4j
public class AuditRecorder {

    static final int RECENT_LIMIT = 10_000;

    private final MutationLogStore store;
    private final Clock clock;
    private final Set<UUID> pending = ConcurrentHashMap.newKeySet();
    private final Set<UUID> recent = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<UUID, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<UUID, Boolean> eldest) {
                    return size() > RECENT_LIMIT;
                }
            }));

    public AuditRecorder(MutationLogStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Records the outcome of a decision seen for the first time.
     *
     * @throws IllegalStateException if the decision already has an entry
     * @throws AuditWriteException if the store rejects the append
     */
    public MutationLogEntry record(Decision decision, MutationOutcome outcome, String errorDetail, Instant appliedAt) {
        UUID id = decision.decisionId();
        if (pending.contains(id) || !recent.add(id)) {
            throw new IllegalStateException("Decision " + id + " already has a mutation log entry");
        }
        try {
            if (outcome != MutationOutcome.PENDING_APPROVAL) {
                return append(decision, outcome, errorDetail, appliedAt);
            }
            // held under the resolution lock so a resolve cannot slip in before the id is tracked
            synchronized (this) {
                MutationLogEntry entry = append(decision, outcome, errorDetail, appliedAt);
                pending.add(id);
                return entry;
            }
        } catch (AuditWriteException e) {
            // release the claim so the outcome can be recorded once the store is back
            recent.remove(id);
            throw e;
        }
    }

    /**
     * Records the resolution of a decision held for approval.
     *
     * @throws IllegalStateException if the decision is not pending
     */
    public synchronized MutationLogEntry resolvePending(Decision decision, MutationOutcome outcome,
                                                        String errorDetail, Instant appliedAt) {
        if (outcome.isProvisional()) {
            throw new IllegalArgumentException("A resolution must be terminal, got " + outcome);
        }
        UUID id = decision.decisionId();
        boolean claimed = pending.remove(id) || isPendingInStore(id);
        if (!claimed) {
            throw new IllegalStateException("Decision " + id + " is not pending approval");
        }
        try {
            MutationLogEntry entry = append(decision, outcome, errorDetail, appliedAt);
            recent.add(id);
            return entry;
        } catch (AuditWriteException e) {
            pending.add(id);
            throw e;
        }
    }

    public boolean hasEntry(UUID decisionId) {
        return pending.contains(decisionId) || recent.contains(decisionId)
                || store.latestFor(decisionId).isPresent();
    }

    int pendingCount() {
        return pending.size();
    }

    private boolean isPendingInStore(UUID decisionId) {
        return store.latestFor(decisionId)
                .map(entry -> entry.outcome() == MutationOutcome.PENDING_APPROVAL)
                .orElse(false);
    }

    private MutationLogEntry append(Decision decision, MutationOutcome outcome, String errorDetail, Instant appliedAt) {
        MutationLogEntry entry = new MutationLogEntry(UUID.randomUUID(), decision, outcome, errorDetail,
                outcome == MutationOutcome.APPLIED ? appliedAt : null, clock.instant());
        try {
            store.append(entry);
        } catch (AuditWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditWriteException("Mutation log append failed for decision " + decision.decisionId(), e);
        }
        mirror(entry);
        return entry;
    }

    private void mirror(MutationLogEntry entry) {
        Decision d = entry.decision();
        String detail = entry.errorDetail() == null ? "" : " | detail=" + entry.errorDetail();
        if (entry.outcome() == MutationOutcome.FAILED || entry.outcome() == MutationOutcome.REJECTED) {
            log.warn("Audit: {} | tenant={} | table={} | fields={} | action={} | score={} | reason={}{}",
                    entry.outcome(), d.tenantId(), d.candidate().table(), d.candidate().fields(), d.action(),
                    String.format("%.1f", d.score()), d.reasonText(), detail);
        } else {
            log.info("Audit: {} | tenant={} | table={} | fields={} | action={} | score={} | reason={}{}",
                    entry.outcome(), d.tenantId(), d.candidate().table(), d.candidate().fields(), d.action(),
                    String.format("%.1f", d.score()), d.reasonText(), detail);
        }
    }
}
