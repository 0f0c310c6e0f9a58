package org.carball.autoindex.aggregator;

import java.time.Instant;

public record AggregatorMetrics(long accepted,
                                long droppedLate,
                                long droppedMalformed,
                                long windowsEmitted,
                                int openWindows,
                                Instant watermark) {
}
