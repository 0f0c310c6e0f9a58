package org.carball.autoindex.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.autoindex.model.audit.MutationLogEntry;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.Decision;
import org.carball.autoindex.model.decision.DecisionAction;
import org.carball.autoindex.model.decision.IndexCandidate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Flat, versioned shape of a mutation log entry, shared by the JSON-lines file
 * and the {@code mutation_log} table. Column names are part of the contract
 * with dashboards; add fields, never rename them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MutationLogRow(
        @JsonProperty("schema_version") int schemaVersion,
        @JsonProperty("entry_id") UUID entryId,
        @JsonProperty("decision_id") UUID decisionId,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("field_names") List<String> fieldNames,
        @JsonProperty("action") DecisionAction action,
        @JsonProperty("score") double score,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("estimated_benefit") double estimatedBenefit,
        @JsonProperty("estimated_build_cost") double estimatedBuildCost,
        @JsonProperty("index_exists") boolean indexExists,
        @JsonProperty("reason_text") String reasonText,
        @JsonProperty("query_count") long queryCount,
        @JsonProperty("window_start") Instant windowStart,
        @JsonProperty("window_end") Instant windowEnd,
        @JsonProperty("evaluated_at") Instant evaluatedAt,
        @JsonProperty("outcome") MutationOutcome outcome,
        @JsonProperty("error_detail") String errorDetail,
        @JsonProperty("applied_at") Instant appliedAt,
        @JsonProperty("recorded_at") Instant recordedAt) {

    public static final int SCHEMA_VERSION = 1;

    public static MutationLogRow from(MutationLogEntry entry) {
        Decision d = entry.decision();
        IndexCandidate c = d.candidate();
        return new MutationLogRow(SCHEMA_VERSION, entry.entryId(), d.decisionId(), c.tenantId(), c.table(),
                c.fields(), d.action(), d.score(), d.confidence(), d.estimatedBenefit(), c.estimatedBuildCost(),
                c.currentIndexExists(), d.reasonText(), d.queryCount(), d.windowStart(), d.windowEnd(),
                d.evaluatedAt(), entry.outcome(), entry.errorDetail(), entry.appliedAt(), entry.recordedAt());
    }

    public MutationLogEntry toEntry() {
        if (entryId == null || decisionId == null || action == null || outcome == null
                || reasonText == null || recordedAt == null) {
            throw new IllegalArgumentException("incomplete mutation log row " + entryId);
        }
        IndexCandidate candidate = new IndexCandidate(tenantId, tableName, fieldNames, estimatedBuildCost, indexExists);
        Decision decision = new Decision(decisionId, candidate, action, score, confidence, estimatedBenefit,
                reasonText, queryCount, windowStart, windowEnd, evaluatedAt);
        return new MutationLogEntry(entryId, decision, outcome, errorDetail, appliedAt, recordedAt);
    }
}
