package org.carball.autoindex.engine;

import org.carball.autoindex.audit.InMemoryMutationLogStore;
import org.carball.autoindex.catalog.InMemorySchemaCatalog;
import org.carball.autoindex.catalog.InMemoryTenantFieldActivationSource;
import org.carball.autoindex.config.IndexerOptions;
import org.carball.autoindex.executor.IndexDefinition;
import org.carball.autoindex.model.audit.MutationLogEntry;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.DecisionAction;
import org.carball.autoindex.model.schema.Column;
import org.carball.autoindex.model.schema.Index;
import org.carball.autoindex.model.schema.Table;
import org.carball.autoindex.model.telemetry.PredicateKind;
import org.carball.autoindex.model.telemetry.QueryRecord;
import org.carball.autoindex.parser.QueryTelemetrySource;
import org.carball.autoindex.safety.PendingApproval;
import org.carball.autoindex.support.FakeIndexDdlClient;
import org.carball.autoindex.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexAdvisoryEngineTest {

    private static final Instant WINDOW_START = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemorySchemaCatalog catalog;
    private InMemoryTenantFieldActivationSource activations;
    private FakeIndexDdlClient ddlClient;
    private InMemoryMutationLogStore logStore;
    private ListTelemetrySource telemetry;
    private IndexAdvisoryEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(WINDOW_START);
        catalog = new InMemorySchemaCatalog().addTable(ordersTable());
        activations = new InMemoryTenantFieldActivationSource(clock);
        activations.enableField("acme", "orders", "status");
        activations.enableField("acme", "orders", "created_at");
        activations.enableField("globex", "orders", "status");
        ddlClient = new FakeIndexDdlClient(catalog);
        logStore = new InMemoryMutationLogStore();
        telemetry = new ListTelemetrySource();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void shouldBuildIndexForHeavilyQueriedField() {
        // Given
        engine = engine(IndexerOptions.defaults());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();

        // Then
        assertThat(summary.recordsIngested()).isEqualTo(500);
        assertThat(summary.decisions()).isEqualTo(1);
        assertThat(summary.created()).isEqualTo(1);
        assertThat(ddlClient.getCreated()).hasSize(1);
        assertThat(ddlClient.getCreated().get(0).tenantId()).isEqualTo("acme");

        MutationLogEntry entry = logStore.readAll().get(0);
        assertThat(entry.outcome()).isEqualTo(MutationOutcome.APPLIED);
        assertThat(entry.appliedAt()).isEqualTo(clock.instant());
        assertThat(entry.decision().action()).isEqualTo(DecisionAction.CREATE);
        assertThat(entry.decision().queryCount()).isEqualTo(500);
    }

    @Test
    void shouldNotBuildSameIndexTwice() {
        // Given
        engine = engine(IndexerOptions.defaults());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));
        engine.runCycle();

        // When
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START.plus(Duration.ofHours(1))));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(126)));
        CycleSummary second = engine.runCycle();

        // Then
        assertThat(second.skipped()).isEqualTo(1);
        assertThat(ddlClient.getCreateCalls()).isEqualTo(1);
        MutationLogEntry latest = logStore.readAll().get(1);
        assertThat(latest.outcome()).isEqualTo(MutationOutcome.SKIPPED);
        assertThat(latest.decision().reasonText()).isEqualTo("existing index already covers field");
    }

    @Test
    void shouldBuildSeparateIndexPerTenant() {
        // Given
        engine = engine(IndexerOptions.defaults());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        telemetry.add(queries("globex", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();

        // Then
        assertThat(summary.created()).isEqualTo(2);
        assertThat(ddlClient.getCreated()).extracting(IndexDefinition::tenantId)
                .containsExactlyInAnyOrder("acme", "globex");
    }

    @Test
    void shouldRecordEveryDecisionExactlyOnce() {
        // Given
        engine = engine(IndexerOptions.defaults());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        telemetry.add(queries("acme", "created_at", PredicateKind.RANGE, 5, WINDOW_START));
        telemetry.add(queries("globex", "status", PredicateKind.EQUALITY, 20, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();

        // Then
        assertThat(summary.decisions()).isEqualTo(3);
        assertThat(summary.created()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(2);
        List<MutationLogEntry> entries = logStore.readAll();
        assertThat(entries).hasSize(3);
        assertThat(entries).extracting(MutationLogEntry::decisionId).doesNotHaveDuplicates();
        assertThat(entries).filteredOn(e -> e.outcome() == MutationOutcome.SKIPPED)
                .allSatisfy(e -> assertThat(e.decision().reasonText()).startsWith("insufficient data"));
    }

    @Test
    void shouldIgnoreFieldsTheTenantHasNotEnabled() {
        // Given
        engine = engine(IndexerOptions.defaults());
        telemetry.add(queries("acme", "region", PredicateKind.EQUALITY, 500, WINDOW_START));
        telemetry.add(queries("initech", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();

        // Then
        assertThat(summary.ineligible()).isEqualTo(2);
        assertThat(summary.decisions()).isZero();
        assertThat(logStore.readAll()).isEmpty();
        assertThat(ddlClient.getCreateCalls()).isZero();
    }

    @Test
    void shouldOnlyDecideClosedWindows() {
        // Given
        engine = engine(IndexerOptions.defaults());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(62)));

        // When
        CycleSummary early = engine.runCycle();
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));
        CycleSummary later = engine.runCycle();

        // Then
        assertThat(early.decisions()).isZero();
        assertThat(later.decisions()).isEqualTo(1);
        assertThat(later.recordsIngested()).isZero();
    }

    @Test
    void shouldRecordRecommendationsWithoutBuildingInAdvisoryMode() {
        // Given
        engine = engine(IndexerOptions.builder().advisoryMode(true).build());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();

        // Then
        assertThat(summary.bypassed()).isEqualTo(1);
        assertThat(ddlClient.getCreateCalls()).isZero();
        MutationLogEntry entry = logStore.readAll().get(0);
        assertThat(entry.outcome()).isEqualTo(MutationOutcome.BYPASSED);
        assertThat(entry.decision().action()).isEqualTo(DecisionAction.CREATE);
        assertThat(entry.errorDetail()).isEqualTo("advisory mode");
    }

    @Test
    void shouldBypassMutationsWhileSwitchIsOn() {
        // Given
        engine = engine(IndexerOptions.defaults());
        engine.enableBypass("incident 42");
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();

        // Then
        assertThat(summary.bypassed()).isEqualTo(1);
        assertThat(engine.status().mutationsBypassed()).isTrue();
        assertThat(engine.status().bypassReason()).contains("incident 42");

        // When
        engine.disableBypass();

        // Then
        assertThat(engine.status().mutationsBypassed()).isFalse();
    }

    @Test
    void shouldRateLimitBuildsPerTenant() {
        // Given
        engine = engine(IndexerOptions.builder().burstCapacity(1).rateLimitPerWindow(1).build());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        telemetry.add(queries("acme", "created_at", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();

        // Then
        assertThat(summary.created()).isEqualTo(1);
        assertThat(summary.rateLimited()).isEqualTo(1);
        assertThat(summary.deferred()).isEqualTo(1);
        MutationLogEntry limited = logStore.readAll().stream()
                .filter(e -> e.outcome() == MutationOutcome.RATE_LIMITED)
                .findFirst().orElseThrow();
        assertThat(limited.decision().action()).isEqualTo(DecisionAction.DEFER);
        assertThat(limited.errorDetail()).isEqualTo("rate limit reached for tenant acme");
    }

    @Test
    void shouldBuildApprovedIndex() {
        // Given
        engine = engine(IndexerOptions.builder().requireApproval(true).build());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));
        CycleSummary summary = engine.runCycle();
        assertThat(summary.pendingApproval()).isEqualTo(1);
        assertThat(ddlClient.getCreateCalls()).isZero();

        // When
        PendingApproval pending = engine.pendingApprovals().get(0);
        MutationLogEntry resolution = engine.approve(pending.decision().decisionId(), "ops");

        // Then
        assertThat(resolution.outcome()).isEqualTo(MutationOutcome.APPLIED);
        assertThat(resolution.errorDetail()).isEqualTo("approved by ops");
        assertThat(ddlClient.getCreateCalls()).isEqualTo(1);
        assertThat(engine.pendingApprovals()).isEmpty();
        assertThat(logStore.entriesFor(pending.decision().decisionId()))
                .extracting(MutationLogEntry::outcome)
                .containsExactly(MutationOutcome.PENDING_APPROVAL, MutationOutcome.APPLIED);
    }

    @Test
    void shouldRecordRejectedApproval() {
        // Given
        engine = engine(IndexerOptions.builder().requireApproval(true).build());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));
        engine.runCycle();
        UUID decisionId = engine.pendingApprovals().get(0).decision().decisionId();

        // When
        MutationLogEntry resolution = engine.reject(decisionId, "ops", "peak season freeze");

        // Then
        assertThat(resolution.outcome()).isEqualTo(MutationOutcome.REJECTED);
        assertThat(resolution.errorDetail()).isEqualTo("rejected by ops: peak season freeze");
        assertThat(ddlClient.getCreateCalls()).isZero();
        assertThatThrownBy(() -> engine.approve(decisionId, "ops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No pending approval");
    }

    @Test
    void shouldSkipApprovalWhenIndexAppearedMeanwhile() {
        // Given
        engine = engine(IndexerOptions.builder().requireApproval(true).build());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));
        engine.runCycle();
        UUID decisionId = engine.pendingApprovals().get(0).decision().decisionId();
        catalog.addIndex("orders", Index.builder()
                .name("orders_status_idx").columns(List.of("status")).build());

        // When
        MutationLogEntry resolution = engine.approve(decisionId, "ops");

        // Then
        assertThat(resolution.outcome()).isEqualTo(MutationOutcome.SKIPPED);
        assertThat(resolution.errorDetail()).isEqualTo("approved by ops: existing index already covers field");
        assertThat(ddlClient.getCreateCalls()).isZero();
    }

    @Test
    void shouldRecordFailedBuild() {
        // Given
        engine = engine(IndexerOptions.defaults());
        ddlClient.script(FakeIndexDdlClient.Behaviour.PERMANENT);
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();

        // Then
        assertThat(summary.failed()).isEqualTo(1);
        MutationLogEntry entry = logStore.readAll().get(0);
        assertThat(entry.outcome()).isEqualTo(MutationOutcome.FAILED);
        assertThat(entry.errorDetail()).startsWith("permanent failure: ");
        assertThat(entry.appliedAt()).isNull();
    }

    @Test
    void shouldReportStatus() {
        // Given
        engine = engine(IndexerOptions.defaults());
        telemetry.add(queries("acme", "status", PredicateKind.EQUALITY, 500, WINDOW_START));
        telemetry.add(List.of(QueryRecord.of("acme", "orders", null, PredicateKind.EQUALITY, 10.0, WINDOW_START)));
        clock.set(WINDOW_START.plus(Duration.ofMinutes(66)));

        // When
        CycleSummary summary = engine.runCycle();
        EngineStatus status = engine.status();

        // Then
        assertThat(summary.droppedMalformed()).isEqualTo(1);
        assertThat(status.lastCycle()).isEqualTo(summary);
        assertThat(status.inFlightBuilds()).isZero();
        assertThat(status.pendingApprovals()).isZero();
        assertThat(status.rateLimiterSaturation()).isGreaterThan(0.0);
        assertThat(status.aggregator().accepted()).isEqualTo(500);
    }

    @Test
    void shouldRejectInvalidOptions() {
        assertThatThrownBy(() -> engine(IndexerOptions.builder().minQueryThreshold(0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minQueryThreshold");
    }

    private IndexAdvisoryEngine engine(IndexerOptions options) {
        return IndexAdvisoryEngine.builder()
                .options(options)
                .telemetrySource(telemetry)
                .schemaCatalog(catalog)
                .activationSource(activations)
                .ddlClient(ddlClient)
                .mutationLogStore(logStore)
                .clock(clock)
                .build();
    }

    private static List<QueryRecord> queries(String tenant, String field, PredicateKind kind, int count, Instant windowStart) {
        List<QueryRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(QueryRecord.of(tenant, "orders", field, kind, 50.0,
                    windowStart.plusMillis(i * 1000L)));
        }
        return records;
    }

    private static Table ordersTable() {
        Table table = new Table("orders");
        table.setRowCountEstimate(100_000);
        table.setWritesPerWindowEstimate(1_000);
        table.setTenantColumn("tenant_id");
        table.addColumn(Column.builder().name("tenant_id").dataType("text").distinctEstimate(50).build());
        table.addColumn(Column.builder().name("status").dataType("text").distinctEstimate(5).build());
        table.addColumn(Column.builder().name("created_at").dataType("timestamptz").distinctEstimate(90_000).build());
        return table;
    }

    private static final class ListTelemetrySource implements QueryTelemetrySource {
        private final List<QueryRecord> records = new ArrayList<>();
        private int position;

        synchronized void add(List<QueryRecord> batch) {
            records.addAll(batch);
        }

        @Override
        public synchronized List<QueryRecord> poll(int maxRecords) {
            int end = Math.min(records.size(), position + maxRecords);
            List<QueryRecord> batch = new ArrayList<>(records.subList(position, end));
            position = end;
            return batch;
        }
    }
}
