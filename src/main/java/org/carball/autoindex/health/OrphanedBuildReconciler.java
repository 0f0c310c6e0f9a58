package org.carball.autoindex.health;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.audit.AuditRecorder;
import org.carball.autoindex.executor.BuildJournal;
import org.carball.autoindex.executor.BuildJournalEntry;
import org.carball.autoindex.executor.IndexDdlClient;
import org.carball.autoindex.executor.IndexDefinition;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.safety.InFlightRegistry;

import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;

/**
 * Settles builds the executor could not finish.
 * <p>
 * A BUILDING entry whose key is not in flight belongs to a process that died
 * mid-build: the index is APPLIED if it came out valid, otherwise it is dropped
 * and the build is FAILED. A NEEDS_CLEANUP entry already has its outcome
 * logged; only an invalid leftover index is dropped.
 */
@Slf4j
public class OrphanedBuildReconciler {

    private final BuildJournal journal;
    private final IndexDdlClient ddlClient;
    private final AuditRecorder auditRecorder;
    private final InFlightRegistry inFlightRegistry;
    private final Clock clock;

    public OrphanedBuildReconciler(BuildJournal journal, IndexDdlClient ddlClient, AuditRecorder auditRecorder,
                                   InFlightRegistry inFlightRegistry, Clock clock) {
        this.journal = journal;
        this.ddlClient = ddlClient;
        this.auditRecorder = auditRecorder;
        this.inFlightRegistry = inFlightRegistry;
        this.clock = clock;
    }

    public ReconciliationSummary reconcile() {
        int applied = 0;
        int failed = 0;
        int dropped = 0;
        int running = 0;

        for (BuildJournalEntry entry : journal.openEntries()) {
            IndexDefinition definition = entry.definition();
            try {
                if (entry.status() == BuildJournalEntry.Status.BUILDING) {
                    if (inFlightRegistry.isHeld(entry.decision().key())) {
                        running++;
                        continue;
                    }
                    if (settleOrphan(entry)) {
                        applied++;
                    } else {
                        failed++;
                    }
                } else if (cleanUp(definition)) {
                    dropped++;
                }
                journal.complete(entry.decisionId());
            } catch (SQLException e) {
                log.warn("Could not reconcile build of {} (decision {}), will retry next pass: {}",
                        definition.indexName(), entry.decisionId(), e.getMessage());
            }
        }

        ReconciliationSummary summary = new ReconciliationSummary(applied, failed, dropped, running);
        if (summary.total() > 0) {
            log.info("Reconciled builds: {} applied, {} failed, {} leftovers dropped", applied, failed, dropped);
        }
        return summary;
    }

    private boolean settleOrphan(BuildJournalEntry entry) throws SQLException {
        IndexDefinition definition = entry.definition();
        Optional<Boolean> validity = ddlClient.indexValidity(definition.schemaName(), definition.indexName());
        boolean alreadyLogged = auditRecorder.hasEntry(entry.decisionId());

        if (validity.orElse(false)) {
            log.warn("Orphaned build of {} completed before the executor stopped; recording as applied",
                    definition.indexName());
            if (!alreadyLogged) {
                auditRecorder.record(entry.decision(), MutationOutcome.APPLIED,
                        "reconciled: build completed but was never acknowledged", clock.instant());
            }
            return true;
        }

        if (validity.isPresent()) {
            log.warn("Dropping invalid index {} left by an orphaned build", definition.indexName());
            ddlClient.dropIndex(definition.schemaName(), definition.indexName());
        }
        if (!alreadyLogged) {
            auditRecorder.record(entry.decision(), MutationOutcome.FAILED,
                    "reconciled: orphaned build did not complete", null);
        }
        return false;
    }

    private boolean cleanUp(IndexDefinition definition) throws SQLException {
        Optional<Boolean> validity = ddlClient.indexValidity(definition.schemaName(), definition.indexName());
        if (validity.isEmpty()) {
            return false;
        }
        if (validity.get()) {
            log.warn("Build of {} was reported as failed but the index is valid; leaving it in place",
                    definition.indexName());
            return false;
        }
        log.info("Dropping invalid index {} left by a failed build", definition.indexName());
        ddlClient.dropIndex(definition.schemaName(), definition.indexName());
        return true;
    }
}
