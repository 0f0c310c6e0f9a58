package org.carball.autoindex.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Calibration constants for the cost model. Costs are expressed in
 * query-milliseconds so benefit and build cost are directly comparable.
 */
@Data
public class CostModelConfig {

    // How much faster an indexed lookup is than a scan for a perfectly selective predicate
    @JsonProperty("scan_to_seek_ratio")
    private double scanToSeekRatio = 10.0;

    @JsonProperty("build_cost_per_1000_rows")
    private double buildCostPer1000Rows = 20.0;

    // Extra cost every write pays to maintain one more index
    @JsonProperty("write_amplification_cost_ms")
    private double writeAmplificationCostMs = 0.5;

    @JsonProperty("bloat_penalty_weight")
    private double bloatPenaltyWeight = 1.0;

    @JsonProperty("rarely_used_threshold")
    private long rarelyUsedThreshold = 50;

    @JsonProperty("max_health_penalty")
    private double maxHealthPenalty = 4.0;

    @JsonProperty("bloated_ratio_threshold")
    private double bloatedRatioThreshold = 0.3;

    // Predicate effectiveness, 0..1
    @JsonProperty("equality_effectiveness")
    private double equalityEffectiveness = 1.0;

    @JsonProperty("join_effectiveness")
    private double joinEffectiveness = 0.9;

    @JsonProperty("prefix_effectiveness")
    private double prefixEffectiveness = 0.7;

    @JsonProperty("range_effectiveness")
    private double rangeEffectiveness = 0.6;

    public static CostModelConfig defaults() {
        return new CostModelConfig();
    }

    public CostModelConfig copy() {
        CostModelConfig copy = new CostModelConfig();
        copy.setScanToSeekRatio(scanToSeekRatio);
        copy.setBuildCostPer1000Rows(buildCostPer1000Rows);
        copy.setWriteAmplificationCostMs(writeAmplificationCostMs);
        copy.setBloatPenaltyWeight(bloatPenaltyWeight);
        copy.setRarelyUsedThreshold(rarelyUsedThreshold);
        copy.setMaxHealthPenalty(maxHealthPenalty);
        copy.setBloatedRatioThreshold(bloatedRatioThreshold);
        copy.setEqualityEffectiveness(equalityEffectiveness);
        copy.setJoinEffectiveness(joinEffectiveness);
        copy.setPrefixEffectiveness(prefixEffectiveness);
        copy.setRangeEffectiveness(rangeEffectiveness);
        return copy;
    }

    void collectViolations(List<String> violations) {
        if (!(scanToSeekRatio > 1.0)) {
            violations.add("cost_model.scan_to_seek_ratio (" + scanToSeekRatio + ") must be greater than 1.0");
        }
        if (!(buildCostPer1000Rows >= 0)) {
            violations.add("cost_model.build_cost_per_1000_rows (" + buildCostPer1000Rows + ") must not be negative");
        }
        if (!(writeAmplificationCostMs >= 0)) {
            violations.add("cost_model.write_amplification_cost_ms (" + writeAmplificationCostMs + ") must not be negative");
        }
        if (!(bloatPenaltyWeight >= 0)) {
            violations.add("cost_model.bloat_penalty_weight (" + bloatPenaltyWeight + ") must not be negative");
        }
        if (rarelyUsedThreshold < 0) {
            violations.add("cost_model.rarely_used_threshold (" + rarelyUsedThreshold + ") must not be negative");
        }
        if (!(maxHealthPenalty >= 1.0)) {
            violations.add("cost_model.max_health_penalty (" + maxHealthPenalty + ") must be at least 1.0");
        }
        if (!(bloatedRatioThreshold > 0 && bloatedRatioThreshold <= 1.0)) {
            violations.add("cost_model.bloated_ratio_threshold (" + bloatedRatioThreshold + ") must be in (0, 1]");
        }
        checkEffectiveness(violations, "equality_effectiveness", equalityEffectiveness);
        checkEffectiveness(violations, "join_effectiveness", joinEffectiveness);
        checkEffectiveness(violations, "prefix_effectiveness", prefixEffectiveness);
        checkEffectiveness(violations, "range_effectiveness", rangeEffectiveness);
    }

    private static void checkEffectiveness(List<String> violations, String name, double value) {
        if (!(value >= 0 && value <= 1.0)) {
            violations.add("cost_model." + name + " (" + value + ") must be between 0 and 1");
        }
    }

    public String getDescription() {
        return String.format("Cost model: seekRatio=%.1f, build/1000rows=%.1fms, writeAmp=%.2fms, bloatWeight=%.1f, maxPenalty=%.1f",
                scanToSeekRatio, buildCostPer1000Rows, writeAmplificationCostMs, bloatPenaltyWeight, maxHealthPenalty);
    }
}
