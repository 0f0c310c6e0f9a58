package org.carball.autoindex.aggregator;

import org.carball.autoindex.model.stats.Statistics;
import org.carball.autoindex.model.telemetry.PredicateKind;
import org.carball.autoindex.model.telemetry.QueryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StatAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private StatAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new StatAggregator(Duration.ofHours(1), null, Duration.ofMinutes(5));
    }

    @Test
    void shouldEmitStatisticsWhenWindowCloses() {
        // Given
        for (int i = 0; i < 10; i++) {
            aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY,
                    100 + i * 10, T0.plusSeconds(i * 60L)));
        }

        // When
        List<Statistics> stillOpen = aggregator.advanceWatermark(T0.plus(Duration.ofMinutes(64)));
        List<Statistics> closed = aggregator.advanceWatermark(T0.plus(Duration.ofMinutes(65)));

        // Then
        assertThat(stillOpen).isEmpty();
        assertThat(closed).hasSize(1);
        Statistics stats = closed.get(0);
        assertThat(stats.tenantId()).isEqualTo("acme");
        assertThat(stats.table()).isEqualTo("orders");
        assertThat(stats.field()).isEqualTo("status");
        assertThat(stats.queryCount()).isEqualTo(10);
        assertThat(stats.avgDurationMs()).isEqualTo(145.0);
        assertThat(stats.p95DurationMs()).isEqualTo(190.0);
        assertThat(stats.p99DurationMs()).isEqualTo(190.0);
        assertThat(stats.windowStart()).isEqualTo(T0);
        assertThat(stats.windowEnd()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(stats.predicateKinds()).containsExactly(PredicateKind.EQUALITY);
    }

    @Test
    void shouldKeepKeysSeparatePerTenant() {
        // Given
        aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 10, T0));
        aggregator.accept(QueryRecord.of("globex", "orders", "status", PredicateKind.RANGE, 20, T0));
        aggregator.accept(QueryRecord.of("acme", "orders", "created_at", PredicateKind.RANGE, 30, T0));

        // When
        List<Statistics> closed = aggregator.advanceWatermark(T0.plus(Duration.ofHours(2)));

        // Then
        assertThat(closed).extracting(s -> s.key().toString())
                .containsExactly("acme/orders.created_at", "acme/orders.status", "globex/orders.status");
    }

    @Test
    void shouldCountEachFieldOncePerRecord() {
        // Given
        QueryRecord record = new QueryRecord("acme", "orders", List.of("status", "status", "region"),
                PredicateKind.EQUALITY, 40, T0);

        // When
        aggregator.accept(record);
        List<Statistics> closed = aggregator.advanceWatermark(T0.plus(Duration.ofHours(2)));

        // Then
        assertThat(closed).hasSize(2);
        assertThat(closed).allSatisfy(s -> assertThat(s.queryCount()).isEqualTo(1));
    }

    @Test
    void shouldDropMalformedRecordsAndCountThem() {
        // When
        boolean nullField = aggregator.accept(QueryRecord.of("acme", "orders", null, PredicateKind.EQUALITY, 5, T0));
        boolean negative = aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, -1, T0));
        boolean nan = aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, Double.NaN, T0));
        boolean noKind = aggregator.accept(QueryRecord.of("acme", "orders", "status", null, 5, T0));
        boolean noTenant = aggregator.accept(QueryRecord.of(" ", "orders", "status", PredicateKind.EQUALITY, 5, T0));

        // Then
        assertThat(List.of(nullField, negative, nan, noKind, noTenant)).containsOnly(false);
        assertThat(aggregator.metrics().droppedMalformed()).isEqualTo(5);
        assertThat(aggregator.metrics().accepted()).isZero();
    }

    @Test
    void shouldDropOutOfRangeTimestampsWithoutThrowing() {
        // Given
        StatAggregator clocked = new StatAggregator(Duration.ofHours(1), null, Duration.ofMinutes(5),
                Clock.fixed(T0.plus(Duration.ofMinutes(30)), ZoneOffset.UTC));

        // When
        boolean max = clocked.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 5, Instant.MAX));
        boolean min = clocked.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 5, Instant.MIN));

        // Then
        assertThat(max).isFalse();
        assertThat(min).isFalse();
        assertThat(clocked.metrics().droppedMalformed()).isEqualTo(2);
        assertThat(clocked.advanceWatermark(T0.plus(Duration.ofHours(2)))).isEmpty();
    }

    @Test
    void shouldKeepAcceptingRecordsAfterFarFutureTimestamp() {
        // Given
        StatAggregator clocked = new StatAggregator(Duration.ofHours(1), null, Duration.ofMinutes(5),
                Clock.fixed(T0.plus(Duration.ofMinutes(30)), ZoneOffset.UTC));
        boolean future = clocked.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 5,
                Instant.parse("2999-01-01T00:00:00Z")));

        // When
        boolean current = clocked.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 5,
                T0.plus(Duration.ofMinutes(10))));
        boolean nearFuture = clocked.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 5,
                T0.plus(Duration.ofMinutes(80))));

        // Then
        assertThat(future).isFalse();
        assertThat(current).isTrue();
        assertThat(nearFuture).isTrue();
        assertThat(clocked.metrics().droppedMalformed()).isEqualTo(1);
        assertThat(clocked.metrics().droppedLate()).isZero();
        assertThat(clocked.metrics().watermark()).isEqualTo(T0.plus(Duration.ofMinutes(80)));
    }

    @Test
    void shouldDropRecordsArrivingAfterTheirWindowClosed() {
        // Given
        aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 10, T0));
        aggregator.advanceWatermark(T0.plus(Duration.ofMinutes(70)));

        // When
        boolean accepted = aggregator.accept(QueryRecord.of("acme", "orders", "status",
                PredicateKind.EQUALITY, 10, T0.plus(Duration.ofMinutes(30))));

        // Then
        assertThat(accepted).isFalse();
        assertThat(aggregator.metrics().droppedLate()).isEqualTo(1);
    }

    @Test
    void shouldAcceptLateRecordsWithinAllowedLateness() {
        // Given
        aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 10, T0));
        aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 10,
                T0.plus(Duration.ofMinutes(62))));

        // When
        boolean accepted = aggregator.accept(QueryRecord.of("acme", "orders", "status",
                PredicateKind.RANGE, 30, T0.plus(Duration.ofMinutes(59))));
        List<Statistics> closed = aggregator.advanceWatermark(T0.plus(Duration.ofMinutes(65)));

        // Then
        assertThat(accepted).isTrue();
        assertThat(closed).hasSize(1);
        assertThat(closed.get(0).queryCount()).isEqualTo(2);
        assertThat(closed.get(0).predicateKinds()).containsExactlyInAnyOrder(PredicateKind.EQUALITY, PredicateKind.RANGE);
    }

    @Test
    void shouldProduceSameStatisticsRegardlessOfArrivalOrder() {
        // Given
        List<QueryRecord> records = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            records.add(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY,
                    (i * 37) % 101, T0.plusSeconds(i)));
        }
        List<QueryRecord> shuffled = new ArrayList<>(records);
        Collections.reverse(shuffled);
        StatAggregator other = new StatAggregator(Duration.ofHours(1), null, Duration.ofHours(1));
        StatAggregator same = new StatAggregator(Duration.ofHours(1), null, Duration.ofHours(1));

        // When
        same.acceptAll(records);
        other.acceptAll(shuffled);

        // Then
        Instant end = T0.plus(Duration.ofHours(3));
        assertThat(other.advanceWatermark(end)).isEqualTo(same.advanceWatermark(end));
    }

    @Test
    void shouldAssignRecordsToEveryOverlappingSlidingWindow() {
        // Given
        StatAggregator sliding = new StatAggregator(Duration.ofMinutes(30), Duration.ofMinutes(10), Duration.ZERO);
        sliding.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 10,
                T0.plus(Duration.ofMinutes(25))));

        // When
        List<Statistics> closed = sliding.advanceWatermark(T0.plus(Duration.ofHours(2)));

        // Then
        assertThat(closed).hasSize(3);
        assertThat(closed).extracting(Statistics::windowStart).containsExactly(
                T0,
                T0.plus(Duration.ofMinutes(10)),
                T0.plus(Duration.ofMinutes(20)));
    }

    @Test
    void shouldFlushOpenWindowsAndTreatLaterRecordsAsLate() {
        // Given
        aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 10, T0));

        // When
        List<Statistics> flushed = aggregator.flush();
        boolean accepted = aggregator.accept(QueryRecord.of("acme", "orders", "status",
                PredicateKind.EQUALITY, 10, T0.plusSeconds(5)));

        // Then
        assertThat(flushed).hasSize(1);
        assertThat(accepted).isFalse();
        assertThat(aggregator.metrics().openWindows()).isZero();
    }

    @Test
    void shouldNeverMoveWatermarkBackwards() {
        // Given
        aggregator.accept(QueryRecord.of("acme", "orders", "status", PredicateKind.EQUALITY, 10,
                T0.plus(Duration.ofMinutes(30))));

        // When
        aggregator.advanceWatermark(T0);

        // Then
        assertThat(aggregator.metrics().watermark()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
    }

    @Test
    void shouldComputeNearestRankPercentile() {
        double[] sorted = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
        assertThat(StatAggregator.nearestRank(sorted, 0.95)).isEqualTo(10);
        assertThat(StatAggregator.nearestRank(sorted, 0.5)).isEqualTo(5);
        assertThat(StatAggregator.nearestRank(new double[]{42}, 0.99)).isEqualTo(42);
        assertThat(StatAggregator.nearestRank(new double[0], 0.95)).isZero();
    }

    @Test
    void shouldRejectSlideLargerThanWindow() {
        assertThatThrownBy(() -> new StatAggregator(Duration.ofMinutes(10), Duration.ofMinutes(20), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
