package org.carball.autoindex.executor;

import org.carball.autoindex.config.IndexerOptions;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.Decision;
import org.carball.autoindex.support.FakeIndexDdlClient;
import org.carball.autoindex.support.FakeIndexDdlClient.Behaviour;
import org.carball.autoindex.support.MutableClock;
import org.carball.autoindex.support.TestDecisions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MutationExecutorTest {

    private MutableClock clock;
    private FakeIndexDdlClient ddlClient;
    private InMemoryBuildJournal journal;
    private MutationExecutor executor;
    private Decision decision;
    private IndexDefinition definition;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T11:05:00Z"));
        ddlClient = new FakeIndexDdlClient();
        journal = new InMemoryBuildJournal();
        IndexerOptions options = IndexerOptions.builder()
                .buildTimeout(Duration.ofMillis(300))
                .retryBackoff(Duration.ofMillis(10))
                .build();
        executor = new MutationExecutor(ddlClient, journal, options, clock);
        decision = TestDecisions.create("acme", "orders", "status");
        definition = new IndexDefinition("idx_orders_status", "public", "orders",
                List.of("status"), null, null);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void shouldApplySuccessfulBuild() {
        // When
        MutationResult result = executor.execute(decision, definition);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.APPLIED);
        assertThat(result.appliedAt()).isEqualTo(clock.instant());
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(ddlClient.validityOf("idx_orders_status")).contains(true);
        assertThat(journal.openEntries()).hasSize(1);
        assertThat(journal.openEntries().get(0).status()).isEqualTo(BuildJournalEntry.Status.BUILDING);
    }

    @Test
    void shouldCloseJournalEntryOnceAcknowledged() {
        // Given
        MutationResult result = executor.execute(decision, definition);

        // When
        executor.acknowledge(decision.decisionId(), result.outcome());

        // Then
        assertThat(journal.openEntries()).isEmpty();
    }

    @Test
    void shouldSkipWhenValidIndexAlreadyExists() {
        // Given
        ddlClient.putIndex("idx_orders_status", true);

        // When
        MutationResult result = executor.execute(decision, definition);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.SKIPPED);
        assertThat(result.detail()).isEqualTo("index already exists: idx_orders_status");
        assertThat(ddlClient.getCreateCalls()).isZero();
        assertThat(journal.openEntries()).isEmpty();
    }

    @Test
    void shouldDropInvalidLeftoverBeforeBuilding() {
        // Given
        ddlClient.putIndex("idx_orders_status", false);

        // When
        MutationResult result = executor.execute(decision, definition);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.APPLIED);
        assertThat(ddlClient.getDropCalls()).isEqualTo(1);
    }

    @Test
    void shouldFailPermanentErrorWithoutRetry() {
        // Given
        ddlClient.script(Behaviour.PERMANENT);

        // When
        MutationResult result = executor.execute(decision, definition);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.FAILED);
        assertThat(result.detail()).startsWith("permanent failure: ");
        assertThat(result.detail()).contains("[SQLState 42703]");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(ddlClient.getCreateCalls()).isEqualTo(1);
        assertThat(journal.openEntries().get(0).status()).isEqualTo(BuildJournalEntry.Status.NEEDS_CLEANUP);
    }

    @Test
    void shouldRetryTransientErrorOnce() {
        // Given
        ddlClient.script(Behaviour.TRANSIENT);

        // When
        MutationResult result = executor.execute(decision, definition);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.APPLIED);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(ddlClient.getCreateCalls()).isEqualTo(2);
    }

    @Test
    void shouldFailAfterSecondTransientError() {
        // Given
        ddlClient.script(Behaviour.TRANSIENT, Behaviour.TRANSIENT);

        // When
        MutationResult result = executor.execute(decision, definition);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.FAILED);
        assertThat(result.detail()).startsWith("transient failure: ");
        assertThat(ddlClient.getCreateCalls()).isEqualTo(2);
    }

    @Test
    void shouldFailWithTimeoutAndFlagJournalForCleanup() {
        // Given - Scenario E
        ddlClient.script(Behaviour.HANG);

        // When
        long started = System.nanoTime();
        MutationResult result = executor.execute(decision, definition);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.FAILED);
        assertThat(result.detail()).startsWith("timeout");
        assertThat(ddlClient.getCreateCalls()).isEqualTo(1);
        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        assertThat(journal.openEntries()).singleElement()
                .satisfies(e -> assertThat(e.status()).isEqualTo(BuildJournalEntry.Status.NEEDS_CLEANUP));
    }

    @Test
    void shouldFailWhenBuildLeavesInvalidIndex() {
        // Given
        ddlClient.script(Behaviour.LEAVE_INVALID);

        // When
        MutationResult result = executor.execute(decision, definition);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.FAILED);
        assertThat(result.detail()).contains("was left invalid");
    }

    @Test
    void shouldFailWhenExistenceCheckIsUnavailable() {
        // Given
        ddlClient.setCatalogDown(true);

        // When
        MutationResult result = executor.execute(decision, definition);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.FAILED);
        assertThat(result.detail()).startsWith("existence check failed: connection refused");
        assertThat(ddlClient.getCreateCalls()).isZero();
    }

    @Test
    void shouldRejectInvalidDefinitionWithoutDdl() {
        // Given
        IndexDefinition bad = new IndexDefinition("idx_orders_status", "public", "orders; drop table x",
                List.of("status"), null, null);

        // When
        MutationResult result = executor.execute(decision, bad);

        // Then
        assertThat(result.outcome()).isEqualTo(MutationOutcome.FAILED);
        assertThat(result.detail()).startsWith("invalid index definition: ");
        assertThat(result.attempts()).isZero();
        assertThat(ddlClient.getCreateCalls()).isZero();
    }

    @Test
    void shouldRefuseNonCreateDecisions() {
        assertThatThrownBy(() -> executor.execute(TestDecisions.skip("acme", "orders", "status", "x"), definition))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
