package org.carball.autoindex.health;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.config.CostModelConfig;
import org.carball.autoindex.model.health.HealthStatus;
import org.carball.autoindex.model.health.IndexHealthRecord;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The only writer of index health. Each pass samples the database, upserts one
 * record per index, forgets indexes that disappeared, and then reconciles
 * orphaned builds.
 */
@Slf4j
public class HealthRecorder implements AutoCloseable {

    private final IndexStatsSource statsSource;
    private final IndexHealthStore store;
    private final OrphanedBuildReconciler reconciler;
    private final CostModelConfig costModel;
    private final Duration interval;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public HealthRecorder(IndexStatsSource statsSource, IndexHealthStore store, OrphanedBuildReconciler reconciler,
                          CostModelConfig costModel, Duration interval, Clock clock) {
        this.statsSource = statsSource;
        this.store = store;
        this.reconciler = reconciler;
        this.costModel = costModel;
        this.interval = interval;
        this.clock = clock;
    }

    public synchronized HealthPassSummary runOnce() {
        int observed = 0;
        int bloated = 0;
        int underutilized = 0;
        boolean statsAvailable = statsSource != null;

        if (statsSource != null) {
            try {
                List<ObservedIndexStats> samples = statsSource.collect();
                Instant now = clock.instant();
                Set<String> seen = new HashSet<>();

                for (ObservedIndexStats sample : samples) {
                    IndexHealthRecord record = toRecord(sample, now);
                    store.upsert(record);
                    seen.add(record.indexName());
                    observed++;

                    switch (classify(record)) {
                        case BLOATED -> bloated++;
                        case UNDERUTILIZED -> underutilized++;
                        default -> { }
                    }
                }

                for (IndexHealthRecord known : store.all()) {
                    if (!seen.contains(known.indexName())) {
                        store.remove(known.indexName());
                    }
                }
            } catch (SQLException e) {
                statsAvailable = false;
                log.error("Index health sampling failed: {}", e.getMessage());
            }
        }

        ReconciliationSummary reconciliation = reconciler == null
                ? ReconciliationSummary.empty()
                : reconciler.reconcile();

        log.info("Health pass: {} indexes observed, {} bloated, {} underutilized",
                observed, bloated, underutilized);
        return new HealthPassSummary(observed, bloated, underutilized, statsAvailable, reconciliation);
    }

    public HealthStatus classify(IndexHealthRecord record) {
        if (record.bloatRatio() >= costModel.getBloatedRatioThreshold()) {
            return HealthStatus.BLOATED;
        }
        if (record.usageCount() < costModel.getRarelyUsedThreshold()) {
            return HealthStatus.UNDERUTILIZED;
        }
        return HealthStatus.HEALTHY;
    }

    private IndexHealthRecord toRecord(ObservedIndexStats sample, Instant now) {
        IndexHealthRecord previous = store.find(sample.indexName()).orElse(null);

        Instant lastUsedAt;
        if (previous == null) {
            lastUsedAt = sample.scanCount() > 0 ? now : null;
        } else if (sample.scanCount() > previous.usageCount()) {
            lastUsedAt = now;
        } else {
            lastUsedAt = previous.lastUsedAt();
        }

        return new IndexHealthRecord(sample.indexName(), sample.table(), sample.bloatRatio(),
                sample.sizeBytes(), sample.scanCount(), lastUsedAt, now);
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "autoindex-health");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::safeRun, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Health recorder scheduled every {}", interval);
    }

    private void safeRun() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            // an exception here would cancel the schedule
            log.error("Health pass failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
