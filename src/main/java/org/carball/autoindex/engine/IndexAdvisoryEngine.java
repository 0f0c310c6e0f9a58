package org.carball.autoindex.engine;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.aggregator.AggregatorMetrics;
import org.carball.autoindex.aggregator.StatAggregator;
import org.carball.autoindex.analyzer.CostBenefitEvaluator;
import org.carball.autoindex.audit.AuditRecorder;
import org.carball.autoindex.audit.AuditWriteException;
import org.carball.autoindex.audit.InMemoryMutationLogStore;
import org.carball.autoindex.audit.MutationLogStore;
import org.carball.autoindex.catalog.SchemaCatalog;
import org.carball.autoindex.catalog.TenantFieldActivationSource;
import org.carball.autoindex.config.IndexerOptions;
import org.carball.autoindex.executor.BuildJournal;
import org.carball.autoindex.executor.IndexDdlClient;
import org.carball.autoindex.executor.IndexDefinition;
import org.carball.autoindex.executor.InMemoryBuildJournal;
import org.carball.autoindex.executor.MutationExecutor;
import org.carball.autoindex.executor.MutationResult;
import org.carball.autoindex.health.HealthPassSummary;
import org.carball.autoindex.health.HealthRecorder;
import org.carball.autoindex.health.InMemoryIndexHealthStore;
import org.carball.autoindex.health.IndexHealthStore;
import org.carball.autoindex.health.IndexHealthView;
import org.carball.autoindex.health.IndexStatsSource;
import org.carball.autoindex.health.OrphanedBuildReconciler;
import org.carball.autoindex.model.audit.MutationLogEntry;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.Decision;
import org.carball.autoindex.model.decision.DecisionAction;
import org.carball.autoindex.model.schema.Table;
import org.carball.autoindex.model.stats.Statistics;
import org.carball.autoindex.model.telemetry.FieldKey;
import org.carball.autoindex.model.telemetry.QueryRecord;
import org.carball.autoindex.model.tenant.TenantFieldActivation;
import org.carball.autoindex.parser.QueryTelemetrySource;
import org.carball.autoindex.safety.ApprovalQueue;
import org.carball.autoindex.safety.BypassSwitch;
import org.carball.autoindex.safety.GateVerdict;
import org.carball.autoindex.safety.InFlightRegistry;
import org.carball.autoindex.safety.InMemoryApprovalQueue;
import org.carball.autoindex.safety.MaintenanceWindow;
import org.carball.autoindex.safety.PendingApproval;
import org.carball.autoindex.safety.SafetyGate;
import org.carball.autoindex.safety.TokenBucketRateLimiter;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the advisory loop: telemetry into windows, closed windows into
 * decisions, admitted decisions into builds, and every decision into the
 * mutation log.
 *
 * <p>Keys are evaluated in parallel up to {@code maxParallelism}. The audit
 * entry for a key is always written before the next cycle starts, and a
 * failing audit store aborts the cycle rather than let a decision go
 * unrecorded.
 */
@Slf4j
public class IndexAdvisoryEngine implements AutoCloseable {

    private static final int MAX_BATCHES_PER_CYCLE = 100;

    private final IndexerOptions options;
    private final QueryTelemetrySource telemetrySource;
    private final SchemaCatalog schemaCatalog;
    private final TenantFieldActivationSource activationSource;
    private final Clock clock;

    private final StatAggregator aggregator;
    private final CostBenefitEvaluator evaluator;
    private final TokenBucketRateLimiter rateLimiter;
    private final InFlightRegistry inFlightRegistry;
    private final ApprovalQueue approvalQueue;
    private final BypassSwitch bypassSwitch;
    private final SafetyGate gate;
    private final MutationExecutor executor;
    private final AuditRecorder auditRecorder;
    private final IndexHealthView healthView;
    private final HealthRecorder healthRecorder;
    private final ExecutorService workers;

    private ScheduledExecutorService scheduler;
    private volatile CycleSummary lastCycle;

    @Builder
    private IndexAdvisoryEngine(IndexerOptions options,
                                QueryTelemetrySource telemetrySource,
                                SchemaCatalog schemaCatalog,
                                TenantFieldActivationSource activationSource,
                                IndexDdlClient ddlClient,
                                MutationLogStore mutationLogStore,
                                IndexHealthStore healthStore,
                                IndexStatsSource indexStatsSource,
                                BuildJournal buildJournal,
                                ApprovalQueue approvalQueue,
                                BypassSwitch bypassSwitch,
                                Clock clock) {
        this.options = options == null ? IndexerOptions.defaults() : options;
        this.options.validate();
        this.telemetrySource = Objects.requireNonNull(telemetrySource, "telemetrySource");
        this.schemaCatalog = Objects.requireNonNull(schemaCatalog, "schemaCatalog");
        this.activationSource = Objects.requireNonNull(activationSource, "activationSource");
        Objects.requireNonNull(ddlClient, "ddlClient");
        this.clock = clock == null ? Clock.systemUTC() : clock;

        MutationLogStore logStore = mutationLogStore == null ? new InMemoryMutationLogStore() : mutationLogStore;
        IndexHealthStore health = healthStore == null ? new InMemoryIndexHealthStore() : healthStore;
        BuildJournal journal = buildJournal == null ? new InMemoryBuildJournal() : buildJournal;
        this.approvalQueue = approvalQueue == null ? new InMemoryApprovalQueue() : approvalQueue;
        this.bypassSwitch = bypassSwitch == null ? new BypassSwitch() : bypassSwitch;

        this.aggregator = new StatAggregator(this.options, this.clock);
        this.evaluator = new CostBenefitEvaluator(this.options, this.clock);
        this.rateLimiter = new TokenBucketRateLimiter(this.options.getBurstCapacity(),
                this.options.getRateLimitPerWindow(), this.options.getRateLimitWindow(), this.clock);
        this.inFlightRegistry = new InFlightRegistry();
        this.gate = new SafetyGate(this.bypassSwitch, this.options.isAdvisoryMode(), inFlightRegistry,
                rateLimiter, this.approvalQueue, this.options.isRequireApproval(),
                MaintenanceWindow.from(this.options), this.options.getMaintenanceWindowMaxWait(), this.clock);
        this.executor = new MutationExecutor(ddlClient, journal, this.options, this.clock);
        this.auditRecorder = new AuditRecorder(logStore, this.clock);
        this.healthView = health;
        OrphanedBuildReconciler reconciler = new OrphanedBuildReconciler(journal, ddlClient, auditRecorder,
                inFlightRegistry, this.clock);
        this.healthRecorder = new HealthRecorder(indexStatsSource, health, reconciler,
                this.options.getCostModel(), this.options.getHealthCheckInterval(), this.clock);
        this.workers = Executors.newFixedThreadPool(this.options.getMaxParallelism(), workerThreads());

        log.info("Index advisory engine ready: {}", this.options.getConfigurationSummary());
    }

    /**
     * Ingests pending telemetry, closes due windows and decides every key whose
     * window closed.
     *
     * @throws AuditWriteException if a decision could not be recorded
     */
    public synchronized CycleSummary runCycle() {
        UUID cycleId = UUID.randomUUID();
        Instant startedAt = clock.instant();
        AggregatorMetrics before = aggregator.metrics();

        int ingested = ingestTelemetry();
        List<Statistics> closed = aggregator.advanceWatermark(clock.instant());
        Map<FieldKey, Statistics> latest = latestPerKey(closed);

        Map<String, Optional<TenantFieldActivation>> activations = new HashMap<>();
        List<Callable<MutationOutcome>> tasks = new ArrayList<>();
        int ineligible = 0;
        for (Statistics stats : latest.values()) {
            Optional<TenantFieldActivation> activation =
                    activations.computeIfAbsent(stats.tenantId(), this::lookupActivation);
            if (activation.isEmpty() || !activation.get().isActive(stats.table(), stats.field())) {
                log.debug("Field {} is not active, no decision", stats.key());
                ineligible++;
                continue;
            }
            tasks.add(() -> decideAndAct(stats));
        }

        Map<MutationOutcome, Integer> counts = runAll(tasks);

        AggregatorMetrics after = aggregator.metrics();
        CycleSummary summary = new CycleSummary(cycleId, startedAt, clock.instant(), ingested,
                after.droppedLate() - before.droppedLate(),
                after.droppedMalformed() - before.droppedMalformed(),
                tasks.size(),
                counts.getOrDefault(MutationOutcome.APPLIED, 0),
                counts.getOrDefault(MutationOutcome.SKIPPED, 0),
                counts.getOrDefault(MutationOutcome.FAILED, 0),
                counts.getOrDefault(MutationOutcome.RATE_LIMITED, 0),
                counts.getOrDefault(MutationOutcome.PENDING_APPROVAL, 0),
                counts.getOrDefault(MutationOutcome.BYPASSED, 0),
                ineligible);
        lastCycle = summary;

        if (summary.decisions() > 0 || summary.ineligible() > 0) {
            log.info("{}", summary);
        } else {
            log.debug("{}", summary);
        }
        return summary;
    }

    /**
     * Builds an index that was held for approval. The decision keeps its id,
     * so the final log entry supersedes the pending one.
     *
     * @throws IllegalArgumentException if nothing is pending under this id
     */
    public MutationLogEntry approve(UUID decisionId, String approver) {
        PendingApproval pending = approvalQueue.take(decisionId)
                .orElseThrow(() -> new IllegalArgumentException("No pending approval for decision " + decisionId));
        Decision decision = pending.decision();
        log.info("Decision {} approved by {}", decisionId, approver);

        String bypassReason = gate.bypassReason();
        if (bypassReason != null) {
            return auditRecorder.resolvePending(decision, MutationOutcome.BYPASSED, bypassReason, null);
        }

        Optional<InFlightRegistry.Lease> lease = inFlightRegistry.tryAcquire(decision.key());
        if (lease.isEmpty()) {
            return auditRecorder.resolvePending(decision, MutationOutcome.SKIPPED, SafetyGate.DUPLICATE_IN_FLIGHT, null);
        }

        try (InFlightRegistry.Lease held = lease.get()) {
            Table table;
            try {
                table = schemaCatalog.describeTable(decision.tenantId(), decision.candidate().table()).orElse(null);
            } catch (SQLException e) {
                return auditRecorder.resolvePending(decision, MutationOutcome.FAILED,
                        "approved by " + approver + ": schema catalog unavailable: " + e.getMessage(), null);
            }
            if (table == null) {
                return auditRecorder.resolvePending(decision, MutationOutcome.FAILED,
                        "approved by " + approver + ": table no longer present", null);
            }
            if (table.hasIndexCovering(decision.candidate().leadingField(), decision.tenantId())) {
                return auditRecorder.resolvePending(decision, MutationOutcome.SKIPPED,
                        "approved by " + approver + ": " + CostBenefitEvaluator.INDEX_EXISTS, null);
            }

            MutationResult result = executor.execute(decision,
                    IndexDefinition.forCandidate(decision.candidate(), table, options.getSchemaName()));
            String detail = result.detail() == null
                    ? "approved by " + approver
                    : "approved by " + approver + ": " + result.detail();
            MutationLogEntry entry = auditRecorder.resolvePending(decision, result.outcome(), detail, result.appliedAt());
            executor.acknowledge(decisionId, result.outcome());
            return entry;
        }
    }

    /**
     * @throws IllegalArgumentException if nothing is pending under this id
     */
    public MutationLogEntry reject(UUID decisionId, String approver, String reason) {
        PendingApproval pending = approvalQueue.take(decisionId)
                .orElseThrow(() -> new IllegalArgumentException("No pending approval for decision " + decisionId));
        log.info("Decision {} rejected by {}", decisionId, approver);
        return auditRecorder.resolvePending(pending.decision(), MutationOutcome.REJECTED,
                "rejected by " + approver + ": " + reason, null);
    }

    public List<PendingApproval> pendingApprovals() {
        return approvalQueue.pending();
    }

    public void enableBypass(String reason) {
        bypassSwitch.enable(reason);
    }

    public void disableBypass() {
        bypassSwitch.disable();
    }

    public HealthPassSummary runHealthPass() {
        return healthRecorder.runOnce();
    }

    public EngineStatus status() {
        return new EngineStatus(rateLimiter.saturation(), inFlightRegistry.size(), approvalQueue.size(),
                gate.bypassReason() != null, gate.bypassReason(), aggregator.metrics(), lastCycle);
    }

    /**
     * Schedules cycles once per window slide and starts the health recorder.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        Duration period = options.isTumbling() ? options.getWindowSize() : options.getWindowSlide();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "autoindex-cycle");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safeCycle, 0, period.toMillis(), TimeUnit.MILLISECONDS);
        healthRecorder.start();
        log.info("Evaluation cycles scheduled every {}", period);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
        healthRecorder.close();
        workers.shutdownNow();
        executor.close();
    }

    private void safeCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("Evaluation cycle aborted: {}", e.getMessage(), e);
        }
    }

    private int ingestTelemetry() {
        int batchSize = options.getTelemetryBatchSize();
        int total = 0;
        for (int batch = 0; batch < MAX_BATCHES_PER_CYCLE; batch++) {
            List<QueryRecord> records;
            try {
                records = telemetrySource.poll(batchSize);
            } catch (IOException e) {
                log.error("Telemetry poll failed, continuing with what was ingested: {}", e.getMessage());
                break;
            }
            total += records.size();
            aggregator.acceptAll(records);
            if (records.size() < batchSize) {
                break;
            }
        }
        return total;
    }

    private static Map<FieldKey, Statistics> latestPerKey(List<Statistics> closed) {
        Map<FieldKey, Statistics> latest = new LinkedHashMap<>();
        for (Statistics stats : closed) {
            latest.merge(stats.key(), stats,
                    (a, b) -> b.windowEnd().isAfter(a.windowEnd()) ? b : a);
        }
        return latest;
    }

    private Optional<TenantFieldActivation> lookupActivation(String tenantId) {
        try {
            return Optional.of(activationSource.activationFor(tenantId));
        } catch (SQLException e) {
            log.warn("Could not read field activation for tenant {}, skipping its keys this cycle: {}",
                    tenantId, e.getMessage());
            return Optional.empty();
        }
    }

    private MutationOutcome decideAndAct(Statistics stats) {
        Table table;
        Decision decision;
        try {
            table = schemaCatalog.describeTable(stats.tenantId(), stats.table()).orElse(null);
            decision = evaluator.evaluate(stats, table, table == null ? null : healthView.forTable(table.getName()));
        } catch (SQLException e) {
            log.warn("Schema catalog unavailable for {}: {}", stats.key(), e.getMessage());
            table = null;
            decision = evaluator.insufficientData(stats, "schema catalog unavailable");
        }

        if (decision.action() != DecisionAction.CREATE) {
            auditRecorder.record(decision, MutationOutcome.SKIPPED, null, null);
            return MutationOutcome.SKIPPED;
        }

        GateVerdict verdict = gate.admit(decision);
        if (!verdict.isAdmitted()) {
            auditRecorder.record(verdict.decision(), verdict.outcome(), verdict.reason(), null);
            return verdict.outcome();
        }

        try (InFlightRegistry.Lease lease = verdict.lease()) {
            MutationResult result = executor.execute(decision,
                    IndexDefinition.forCandidate(decision.candidate(), table, options.getSchemaName()));
            auditRecorder.record(decision, result.outcome(), result.detail(), result.appliedAt());
            executor.acknowledge(decision.decisionId(), result.outcome());
            return result.outcome();
        }
    }

    private Map<MutationOutcome, Integer> runAll(List<Callable<MutationOutcome>> tasks) {
        Map<MutationOutcome, Integer> counts = new EnumMap<>(MutationOutcome.class);
        if (tasks.isEmpty()) {
            return counts;
        }
        List<Future<MutationOutcome>> futures;
        try {
            futures = workers.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Evaluation cycle interrupted", e);
        }

        RuntimeException failure = null;
        for (Future<MutationOutcome> future : futures) {
            try {
                counts.merge(future.get(), 1, Integer::sum);
            } catch (ExecutionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException
                        ? (RuntimeException) e.getCause() : new IllegalStateException(e.getCause());
                if (failure == null) {
                    failure = cause;
                } else {
                    failure.addSuppressed(cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Evaluation cycle interrupted", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return counts;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "autoindex-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
