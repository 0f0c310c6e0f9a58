package org.carball.autoindex.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.config.IndexerOptions;
import org.carball.autoindex.model.decision.Decision;
import org.carball.autoindex.model.decision.DecisionAction;
import org.carball.autoindex.model.decision.IndexCandidate;
import org.carball.autoindex.model.health.IndexHealthRecord;
import org.carball.autoindex.model.schema.Index;
import org.carball.autoindex.model.schema.Table;
import org.carball.autoindex.model.stats.Statistics;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Turns one window of statistics into exactly one {@link Decision}.
 * <p>
 * A field earns an index when its projected benefit beats the build cost by
 * the safety margin, nothing already covers it and it has seen enough queries.
 * A table that already carries the configured maximum of valid indexes gets
 * none, whatever the benefit. Every other case is a SKIP with the first failing check as the reason. The
 * evaluator never defers (that is the safety gate's call) and never throws:
 * anything it cannot reason about becomes "insufficient data".
 */
@Slf4j
public class CostBenefitEvaluator {

    public static final String INSUFFICIENT_DATA = "insufficient data";
    public static final String INDEX_EXISTS = "existing index already covers field";
    public static final String INDEX_LIMIT_REACHED = "index limit reached";

    private final IndexerOptions options;
    private final CostModel costModel;
    private final Clock clock;

    public CostBenefitEvaluator(IndexerOptions options, Clock clock) {
        this.options = options;
        this.costModel = new CostModel(options.getCostModel());
        this.clock = clock;
        log.debug("Initialized CostBenefitEvaluator with {}", options.getCostModel().getDescription());
    }

    public Decision evaluate(Statistics stats, Table table, Collection<IndexHealthRecord> tableHealth) {
        try {
            return decide(stats, table, tableHealth == null ? List.of() : tableHealth);
        } catch (RuntimeException e) {
            log.warn("Evaluation of {} failed, skipping: {}", stats.key(), e.toString());
            return insufficientData(stats, "evaluation error (" + e.getClass().getSimpleName() + ")");
        }
    }

    /**
     * SKIP for a key whose table could not be described.
     */
    public Decision insufficientData(Statistics stats, String detail) {
        IndexCandidate candidate = new IndexCandidate(stats.tenantId(), stats.table(),
                List.of(stats.field()), 0.0, false);
        String reason = detail == null ? INSUFFICIENT_DATA : INSUFFICIENT_DATA + ": " + detail;
        return decision(stats, candidate, DecisionAction.SKIP, 0.0, 0.0, 0.0, reason);
    }

    private Decision decide(Statistics stats, Table table, Collection<IndexHealthRecord> tableHealth) {
        if (table == null) {
            return insufficientData(stats, "table not present in schema catalog");
        }
        if (stats.isDegenerate()) {
            return insufficientData(stats, null);
        }

        boolean exists = table.hasIndexCovering(stats.field(), stats.tenantId());
        double buildCost = costModel.buildCost(table, stats.field(), tableHealth);
        double benefit = costModel.benefit(stats);
        double score = benefit - buildCost;
        double threshold = buildCost * options.getSafetyMargin();
        double confidence = confidence(benefit, threshold);

        IndexCandidate candidate = new IndexCandidate(stats.tenantId(), stats.table(),
                List.of(stats.field()), buildCost, exists);

        if (exists) {
            return decision(stats, candidate, DecisionAction.SKIP, score, 1.0, benefit, INDEX_EXISTS);
        }

        if (stats.queryCount() < options.getMinQueryThreshold()) {
            String reason = String.format("%s: below minimum query threshold (%d < %d)",
                    INSUFFICIENT_DATA, stats.queryCount(), options.getMinQueryThreshold());
            return decision(stats, candidate, DecisionAction.SKIP, score, 0.0, benefit, reason);
        }

        long indexCount = table.getIndexes().stream().filter(Index::isValid).count();
        if (indexCount >= options.getMaxIndexesPerTable()) {
            String reason = String.format("%s: table %s already has %d indexes (max %d)",
                    INDEX_LIMIT_REACHED, table.getName(), indexCount, options.getMaxIndexesPerTable());
            return decision(stats, candidate, DecisionAction.SKIP, score, confidence, benefit, reason);
        }

        if (!Double.isFinite(benefit) || !Double.isFinite(buildCost)) {
            return decision(stats, candidate, DecisionAction.SKIP, 0.0, 0.0, 0.0, INSUFFICIENT_DATA);
        }

        if (benefit > threshold) {
            String reason = String.format(Locale.ROOT,
                    "benefit %.0fms exceeds build cost %.0fms x margin %.2f", benefit, buildCost, options.getSafetyMargin());
            return decision(stats, candidate, DecisionAction.CREATE, score, confidence, benefit, reason);
        }

        return decision(stats, candidate, DecisionAction.SKIP, score, confidence, benefit, costReason(benefit, threshold));
    }

    private static String costReason(double benefit, double threshold) {
        if (benefit == threshold) {
            return "benefit equals cost threshold";
        }
        if (benefit <= 0) {
            return "cost exceeds benefit (no measurable benefit)";
        }
        double percent = (threshold - benefit) / benefit * 100.0;
        return String.format(Locale.ROOT, "cost exceeds benefit by %.1f%%", percent);
    }

    /**
     * 0.5 at the margin, 1.0 once the benefit is twice what the margin requires.
     */
    static double confidence(double benefit, double threshold) {
        if (threshold <= 0) {
            return benefit > 0 ? 1.0 : 0.0;
        }
        double ratio = benefit / threshold;
        return Math.max(0.0, Math.min(1.0, ratio / 2.0));
    }

    private Decision decision(Statistics stats, IndexCandidate candidate, DecisionAction action,
                              double score, double confidence, double benefit, String reason) {
        Decision decision = new Decision(UUID.randomUUID(), candidate, action, score, confidence, benefit,
                reason, stats.queryCount(), stats.windowStart(), stats.windowEnd(), clock.instant());
        log.debug("Evaluated {}: {} ({})", stats.key(), action, reason);
        return decision;
    }
}
