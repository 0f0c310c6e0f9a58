package org.carball.autoindex.aggregator;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.config.IndexerOptions;
import org.carball.autoindex.model.stats.Statistics;
import org.carball.autoindex.model.telemetry.FieldKey;
import org.carball.autoindex.model.telemetry.PredicateKind;
import org.carball.autoindex.model.telemetry.QueryRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups query records by (tenant, table, field) into event-time windows and
 * emits one {@link Statistics} per key when a window closes.
 * <p>
 * Windows are tumbling when no slide is configured, sliding otherwise. The
 * watermark is the highest event time seen (or the time passed to
 * {@link #advanceWatermark(Instant)}); a window closes once the watermark passes
 * its end plus the allowed lateness. Records that only belong to closed windows
 * are dropped and counted, never thrown.
 * <p>
 * Timestamps before the epoch, or later than one window plus the allowed
 * lateness past the clock's current time, count as malformed and never reach
 * the watermark.
 * <p>
 * Percentiles are exact nearest-rank values over every duration in the window,
 * so the output is deterministic for a given set of records regardless of
 * arrival order.
 */
@Slf4j
public class StatAggregator {

    private static final Comparator<Window> WINDOW_ORDER = Comparator
            .comparing(Window::start)
            .thenComparing(Window::end);

    private final long sizeMillis;
    private final long slideMillis;
    private final long latenessMillis;
    private final Clock clock;

    private final TreeMap<Window, Map<FieldKey, WindowBuffer>> openWindows = new TreeMap<>(WINDOW_ORDER);
    private long watermarkMillis = Long.MIN_VALUE;
    // windows ending at or before this were force-emitted by flush()
    private long flushedThroughMillis = Long.MIN_VALUE;

    private long accepted;
    private long droppedLate;
    private long droppedMalformed;
    private long windowsEmitted;

    public StatAggregator(IndexerOptions options, Clock clock) {
        this(options.getWindowSize(), options.getWindowSlide(), options.getAllowedLateness(), clock);
    }

    public StatAggregator(Duration windowSize, Duration windowSlide, Duration allowedLateness) {
        this(windowSize, windowSlide, allowedLateness, Clock.systemUTC());
    }

    public StatAggregator(Duration windowSize, Duration windowSlide, Duration allowedLateness, Clock clock) {
        Objects.requireNonNull(windowSize, "windowSize");
        if (windowSize.isZero() || windowSize.isNegative()) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }
        Duration slide = windowSlide == null ? windowSize : windowSlide;
        if (slide.isZero() || slide.isNegative() || slide.compareTo(windowSize) > 0) {
            throw new IllegalArgumentException("windowSlide must be positive and not exceed windowSize: " + windowSlide);
        }
        this.sizeMillis = windowSize.toMillis();
        this.slideMillis = slide.toMillis();
        this.latenessMillis = allowedLateness == null ? 0 : Math.max(0, allowedLateness.toMillis());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Offers one record. Returns {@code false} when the record was dropped as
     * malformed or late.
     */
    public synchronized boolean accept(QueryRecord record) {
        if (record == null || !record.isWellFormed()) {
            droppedMalformed++;
            log.debug("Dropping malformed query record: {}", record);
            return false;
        }
        if (!isPlausible(record.timestamp())) {
            droppedMalformed++;
            log.warn("Dropping query record with implausible timestamp {} for {}/{}",
                    record.timestamp(), record.tenantId(), record.table());
            return false;
        }

        long eventMillis = record.timestamp().toEpochMilli();
        List<Window> windows = windowsFor(eventMillis);
        boolean assigned = false;

        for (Window window : windows) {
            if (isSealed(window)) {
                continue;
            }
            Map<FieldKey, WindowBuffer> buffers = openWindows.computeIfAbsent(window, w -> new HashMap<>());
            for (String field : new LinkedHashSet<>(record.fields())) {
                FieldKey key = new FieldKey(record.tenantId(), record.table(), field);
                buffers.computeIfAbsent(key, k -> new WindowBuffer()).add(record.durationMs(), record.predicateKind());
            }
            assigned = true;
        }

        if (!assigned) {
            droppedLate++;
            log.debug("Dropping late query record at {} (watermark {})", record.timestamp(), watermark());
            return false;
        }

        accepted++;
        watermarkMillis = Math.max(watermarkMillis, eventMillis);
        return true;
    }

    private boolean isPlausible(Instant timestamp) {
        if (timestamp.isBefore(Instant.EPOCH)) {
            return false;
        }
        Instant horizon = clock.instant().plusMillis(sizeMillis + latenessMillis);
        return !timestamp.isAfter(horizon);
    }

    public synchronized int acceptAll(Collection<QueryRecord> records) {
        int count = 0;
        for (QueryRecord record : records) {
            if (accept(record)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Moves the watermark forward (never backward) and returns the statistics
     * of every window that is now closed.
     */
    public synchronized List<Statistics> advanceWatermark(Instant to) {
        if (to != null) {
            watermarkMillis = Math.max(watermarkMillis, to.toEpochMilli());
        }
        return drainClosed();
    }

    /**
     * Returns the statistics of every window closed under the current watermark.
     */
    public synchronized List<Statistics> drainClosed() {
        List<Statistics> emitted = new ArrayList<>();
        Iterator<Map.Entry<Window, Map<FieldKey, WindowBuffer>>> it = openWindows.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Window, Map<FieldKey, WindowBuffer>> entry = it.next();
            if (!isClosed(entry.getKey())) {
                continue;
            }
            emit(entry.getKey(), entry.getValue(), emitted);
            it.remove();
        }
        return emitted;
    }

    /**
     * Emits every open window, closed or not. Used at the end of a bounded
     * stream; records arriving afterwards for a flushed window are late.
     */
    public synchronized List<Statistics> flush() {
        List<Statistics> emitted = new ArrayList<>();
        for (Map.Entry<Window, Map<FieldKey, WindowBuffer>> entry : openWindows.entrySet()) {
            emit(entry.getKey(), entry.getValue(), emitted);
            flushedThroughMillis = Math.max(flushedThroughMillis, entry.getKey().end());
        }
        openWindows.clear();
        return emitted;
    }

    public synchronized AggregatorMetrics metrics() {
        return new AggregatorMetrics(accepted, droppedLate, droppedMalformed, windowsEmitted,
                openWindows.size(), watermark());
    }

    private void emit(Window window, Map<FieldKey, WindowBuffer> buffers, List<Statistics> out) {
        List<FieldKey> keys = new ArrayList<>(buffers.keySet());
        keys.sort(null);
        for (FieldKey key : keys) {
            out.add(buffers.get(key).toStatistics(key, window));
        }
        windowsEmitted++;
        log.debug("Closed window [{}, {}) with {} keys", Instant.ofEpochMilli(window.start()),
                Instant.ofEpochMilli(window.end()), keys.size());
    }

    private List<Window> windowsFor(long eventMillis) {
        List<Window> windows = new ArrayList<>();
        long lastStart = Math.floorDiv(eventMillis, slideMillis) * slideMillis;
        for (long start = lastStart; start > eventMillis - sizeMillis; start -= slideMillis) {
            windows.add(new Window(start, start + sizeMillis));
        }
        return windows;
    }

    private boolean isClosed(Window window) {
        return watermarkMillis != Long.MIN_VALUE && window.end() + latenessMillis <= watermarkMillis;
    }

    private boolean isSealed(Window window) {
        return isClosed(window) || window.end() <= flushedThroughMillis;
    }

    private Instant watermark() {
        return watermarkMillis == Long.MIN_VALUE ? null : Instant.ofEpochMilli(watermarkMillis);
    }

    /**
     * Nearest-rank percentile over an ascending array: the value at rank ceil(p * n).
     */
    static double nearestRank(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(percentile * sorted.length);
        rank = Math.min(Math.max(rank, 1), sorted.length);
        return sorted[rank - 1];
    }

    private record Window(long start, long end) {
    }

    private static final class WindowBuffer {
        private double[] durations = new double[16];
        private int size;
        private final Set<PredicateKind> kinds = EnumSet.noneOf(PredicateKind.class);

        void add(double durationMs, PredicateKind kind) {
            if (size == durations.length) {
                durations = Arrays.copyOf(durations, size * 2);
            }
            durations[size++] = durationMs;
            kinds.add(kind);
        }

        Statistics toStatistics(FieldKey key, Window window) {
            double[] sorted = Arrays.copyOf(durations, size);
            Arrays.sort(sorted);
            double sum = 0;
            for (double d : sorted) {
                sum += d;
            }
            return new Statistics(key.tenantId(), key.table(), key.field(),
                    Instant.ofEpochMilli(window.start()), Instant.ofEpochMilli(window.end()),
                    size, sum / size, nearestRank(sorted, 0.95), nearestRank(sorted, 0.99), kinds);
        }
    }
}
