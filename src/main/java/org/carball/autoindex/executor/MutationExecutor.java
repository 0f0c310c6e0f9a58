package org.carball.autoindex.executor;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.config.IndexerOptions;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.Decision;
import org.carball.autoindex.model.decision.DecisionAction;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies admitted CREATE decisions.
 * <p>
 * Each build is re-checked for existence, journaled, then run on a DDL thread
 * under a deadline of {@code buildTimeout}. A transient failure is retried once
 * after {@code retryBackoff} if the deadline allows; a timeout is not retried.
 * Any failure leaves the journal entry flagged for cleanup, since an
 * interrupted concurrent build leaves an invalid index behind. Successful builds
 * stay journaled until {@link #acknowledge} is called after the outcome has
 * been recorded.
 */
@Slf4j
public class MutationExecutor implements AutoCloseable {

    private static final int MAX_ATTEMPTS = 2;

    private final IndexDdlClient ddlClient;
    private final BuildJournal journal;
    private final Duration buildTimeout;
    private final Duration retryBackoff;
    private final Clock clock;
    private final ExecutorService ddlThreads;

    public MutationExecutor(IndexDdlClient ddlClient, BuildJournal journal, IndexerOptions options, Clock clock) {
        this.ddlClient = ddlClient;
        this.journal = journal;
        this.buildTimeout = options.getBuildTimeout();
        this.retryBackoff = options.getRetryBackoff();
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.ddlThreads = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "autoindex-ddl-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public MutationResult execute(Decision decision, IndexDefinition definition) {
        if (decision.action() != DecisionAction.CREATE) {
            throw new IllegalArgumentException("Only CREATE decisions can be executed, got " + decision.action());
        }

        try {
            definition.validate();
        } catch (MutationException e) {
            log.warn("Rejecting build for {}: {}", decision.key(), e.getMessage());
            return MutationResult.failed(e.getDetail(), 0);
        }

        // Idempotency: a valid index of this name means an earlier build already succeeded
        Optional<Boolean> validity;
        try {
            validity = ddlClient.indexValidity(definition.schemaName(), definition.indexName());
        } catch (SQLException e) {
            return MutationResult.failed("existence check failed: " + e.getMessage()
                    + (e.getSQLState() == null ? "" : " [SQLState " + e.getSQLState() + "]"), 0);
        }
        if (validity.orElse(false)) {
            log.info("Index {} already exists, nothing to do", definition.indexName());
            return MutationResult.skipped("index already exists: " + definition.indexName());
        }

        try {
            journal.begin(new BuildJournalEntry(decision, definition, BuildJournalEntry.Status.BUILDING,
                    clock.instant(), null));
        } catch (BuildJournalException e) {
            log.error("Cannot journal build of {}, not building: {}", definition.indexName(), e.getMessage());
            return MutationResult.failed("build journal unavailable: " + e.getMessage(), 0);
        }

        MutationResult result = build(decision.decisionId(), definition, validity.isPresent());
        if (result.outcome() != MutationOutcome.APPLIED) {
            journal.markNeedsCleanup(decision.decisionId(), result.detail());
        }
        return result;
    }

    /**
     * Closes the journal entry of a build whose outcome is now in the mutation
     * log. Failed builds keep their entry until the health pass has cleaned up.
     */
    public void acknowledge(UUID decisionId, MutationOutcome outcome) {
        if (outcome == MutationOutcome.APPLIED) {
            journal.complete(decisionId);
        }
    }

    private MutationResult build(UUID decisionId, IndexDefinition definition, boolean invalidLeftover) {
        long deadline = System.nanoTime() + buildTimeout.toNanos();
        boolean dropFirst = invalidLeftover;
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                if (dropFirst) {
                    // IF NOT EXISTS would otherwise accept the broken index as done
                    log.info("Dropping invalid leftover index {} before building", definition.indexName());
                    ddlClient.dropIndex(definition.schemaName(), definition.indexName());
                }
                runWithDeadline(definition, deadline);
                verifyValid(definition);
                log.info("Built index {} on {} (decision {}, attempt {})",
                        definition.indexName(), definition.table(), decisionId, attempt);
                return MutationResult.applied(clock.instant(), attempt);
            } catch (SQLException e) {
                MutationException failure = SqlErrorClassifier.toMutationException("DROP INDEX " + definition.indexName(), e);
                if (!shouldRetry(failure, attempt, deadline)) {
                    return failedResult(definition, failure, attempt);
                }
            } catch (MutationException e) {
                if (!shouldRetry(e, attempt, deadline)) {
                    return failedResult(definition, e, attempt);
                }
                dropFirst = true;
            }

            try {
                log.info("Retrying build of {} in {}", definition.indexName(), retryBackoff);
                Thread.sleep(retryBackoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return MutationResult.failed("timeout: interrupted while waiting to retry", attempt);
            }
        }
    }

    private boolean shouldRetry(MutationException failure, int attempt, long deadline) {
        if (failure.getKind() != FailureKind.TRANSIENT || attempt >= MAX_ATTEMPTS) {
            return false;
        }
        long remaining = deadline - System.nanoTime();
        return remaining > retryBackoff.toNanos();
    }

    private MutationResult failedResult(IndexDefinition definition, MutationException failure, int attempt) {
        String detail = failure.getKind() == FailureKind.TIMEOUT
                ? "timeout: " + failure.getDetail()
                : failure.getKind().name().toLowerCase(Locale.ROOT) + " failure: " + failure.getDetail();
        log.warn("Build of {} failed after {} attempt(s): {}", definition.indexName(), attempt, detail);
        return MutationResult.failed(detail, attempt);
    }

    private void runWithDeadline(IndexDefinition definition, long deadlineNanos) throws MutationException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new MutationException(FailureKind.TIMEOUT, "build deadline of " + buildTimeout + " exhausted");
        }

        Duration budget = Duration.ofNanos(remaining);
        Future<?> future = ddlThreads.submit(() -> {
            ddlClient.createIndex(definition, budget);
            return null;
        });

        try {
            future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MutationException(FailureKind.TIMEOUT, "build exceeded " + buildTimeout + " and was cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new MutationException(FailureKind.TIMEOUT, "build cancelled by shutdown");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MutationException mutationException) {
                throw mutationException;
            }
            throw new MutationException(FailureKind.PERMANENT, "unexpected build error: " + cause, null, cause);
        }
    }

    private void verifyValid(IndexDefinition definition) throws MutationException {
        try {
            Optional<Boolean> validity = ddlClient.indexValidity(definition.schemaName(), definition.indexName());
            if (!validity.orElse(false)) {
                throw new MutationException(FailureKind.PERMANENT,
                        "index " + definition.indexName() + (validity.isPresent() ? " was left invalid" : " is missing after build"));
            }
        } catch (SQLException e) {
            throw SqlErrorClassifier.toMutationException("validity check of " + definition.indexName(), e);
        }
    }

    @Override
    public void close() {
        ddlThreads.shutdownNow();
    }
}
