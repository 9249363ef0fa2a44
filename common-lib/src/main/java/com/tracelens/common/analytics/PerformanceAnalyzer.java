package com.tracelens.common.analytics;

import com.tracelens.common.aggregation.WindowStats;
import com.tracelens.common.model.Trace;

import java.util.List;

/**
 * Latency percentiles and an overall {@link PerformanceRating} for one window.
 *
 * <p>Percentiles use the nearest-rank method over trace {@code duration_ms}:
 * {@code rank = ceil(p / 100 × n)}, value = the rank-th smallest duration; 0 for an empty window.
 */
public final class PerformanceAnalyzer {

    private PerformanceAnalyzer() {}

    public static PerformanceReport analyze(List<Trace> traces) {
        WindowStats stats = WindowStats.of(traces);
        long[] durations = traces.stream().mapToLong(Trace::durationMs).sorted().toArray();

        double p95 = percentile(durations, 95);
        PerformanceRating rating = PerformanceRating.rate(stats.count(), p95, stats.errorRate());

        return new PerformanceReport(
            stats.avgLatency(),
            percentile(durations, 50),
            p95,
            percentile(durations, 99),
            stats.errorRate(),
            stats.successRate(),
            rating,
            rating.recommendation());
    }

    /**
     * Nearest-rank percentile of an ascending array.
     *
     * @param sorted     ascending values
     * @param percentile in (0, 100]
     */
    public static double percentile(long[] sorted, double percentile) {
        if (sorted.length == 0) return 0.0;
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        int index = Math.max(0, Math.min(sorted.length - 1, rank - 1));
        return sorted[index];
    }
}
