package org.carball.autoindex.analyzer;

import org.carball.autoindex.config.CostModelConfig;
import org.carball.autoindex.model.health.IndexHealthRecord;
import org.carball.autoindex.model.schema.Column;
import org.carball.autoindex.model.schema.Table;
import org.carball.autoindex.model.stats.Statistics;
import org.carball.autoindex.model.telemetry.PredicateKind;

import java.util.Collection;
import java.util.Set;

/**
 * Estimates, in query-milliseconds per window, what an index would save and
 * what it would cost.
 */
public class CostModel {

    private final CostModelConfig config;

    public CostModel(CostModelConfig config) {
        this.config = config;
    }

    /**
     * Per-query cost today. The mean understates tail pain and p95 overstates
     * the typical query, so the midpoint of the two is used.
     */
    public double baselineCostMs(Statistics stats) {
        return (stats.avgDurationMs() + stats.p95DurationMs()) / 2.0;
    }

    public double effectiveness(Set<PredicateKind> kinds) {
        double best = 0.0;
        for (PredicateKind kind : kinds) {
            best = Math.max(best, effectiveness(kind));
        }
        return kinds.isEmpty() ? config.getRangeEffectiveness() : best;
    }

    public double effectiveness(PredicateKind kind) {
        return switch (kind) {
            case EQUALITY -> config.getEqualityEffectiveness();
            case JOIN -> config.getJoinEffectiveness();
            case PREFIX -> config.getPrefixEffectiveness();
            case RANGE -> config.getRangeEffectiveness();
        };
    }

    public double indexedCostMs(double baselineCostMs, double effectiveness) {
        return baselineCostMs / (1.0 + (config.getScanToSeekRatio() - 1.0) * effectiveness);
    }

    public double benefit(Statistics stats) {
        double baseline = baselineCostMs(stats);
        double indexed = indexedCostMs(baseline, effectiveness(stats.predicateKinds()));
        return stats.queryCount() * (baseline - indexed);
    }

    /**
     * Build cost before the health penalty: a one-off build proportional to the
     * row count, plus the write amplification the index adds over one window.
     */
    public double baseBuildCost(Table table, String field) {
        double rows = Math.max(0, table.getRowCountEstimate());
        Column column = table.findColumn(field);
        long cardinality = column == null ? 0 : Math.max(0, column.getDistinctEstimate());

        // Factor 1: build, wider key spaces cost more to sort
        double build = rows / 1000.0 * config.getBuildCostPer1000Rows()
                * (1.0 + Math.log10(1.0 + cardinality) / 10.0);

        // Factor 2: maintenance on every write during the window
        double maintenance = Math.max(0, table.getWritesPerWindowEstimate()) * config.getWriteAmplificationCostMs();

        return build + maintenance;
    }

    /**
     * Multiplier raising the bar on tables whose existing indexes are already
     * bloated. Rarely used bloated indexes weigh fully, busy ones half.
     */
    public double healthPenalty(Collection<IndexHealthRecord> tableHealth) {
        double pressure = 0.0;
        for (IndexHealthRecord record : tableHealth) {
            double bloat = Math.max(0.0, record.bloatRatio());
            pressure += record.usageCount() < config.getRarelyUsedThreshold() ? bloat : bloat / 2.0;
        }
        double penalty = 1.0 + config.getBloatPenaltyWeight() * pressure;
        return Math.min(penalty, config.getMaxHealthPenalty());
    }

    public double buildCost(Table table, String field, Collection<IndexHealthRecord> tableHealth) {
        return baseBuildCost(table, field) * healthPenalty(tableHealth);
    }
}
