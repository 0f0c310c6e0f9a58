package org.carball.autoindex.engine;

import org.carball.autoindex.aggregator.AggregatorMetrics;

public record EngineStatus(double rateLimiterSaturation,
                           int inFlightBuilds,
                           int pendingApprovals,
                           boolean mutationsBypassed,
                           String bypassReason,
                           AggregatorMetrics aggregator,
                           CycleSummary lastCycle) {
}
