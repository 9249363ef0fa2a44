package com.tracelens.common.aggregation;

import com.tracelens.common.model.Trace;

import java.util.List;

/**
 * Scalar rollup of one collection of traces, shared by the dashboard window and the
 * filtered trace listing so both compute rates identically.
 *
 * <pre>
 *   avgLatency  = Σ duration_ms / count                       (0 when count = 0)
 *   errorRate   = 100 × count(status ≠ success) / count       (0 when count = 0)
 *   successRate = 100 − errorRate                             (0 when count = 0)
 * </pre>
 */
public record WindowStats(
    long count,
    double totalCost,
    long totalTokens,
    double avgLatency,
    double errorRate,
    double successRate
) {
    public static final WindowStats EMPTY = new WindowStats(0, 0.0, 0, 0.0, 0.0, 0.0);

    /** Single pass over {@code traces}; never divides by zero. */
    public static WindowStats of(List<Trace> traces) {
        if (traces == null || traces.isEmpty()) return EMPTY;

        long count = 0;
        long failures = 0;
        long totalTokens = 0;
        long totalDurationMs = 0;
        double totalCost = 0.0;
        for (Trace trace : traces) {
            count++;
            totalCost       += trace.totalCostUsd();
            totalTokens     += trace.totalTokens();
            totalDurationMs += trace.durationMs();
            if (trace.status().isFailure()) failures++;
        }

        double avgLatency  = (double) totalDurationMs / count;
        double errorRate   = 100.0 * failures / count;
        double successRate = 100.0 - errorRate;
        return new WindowStats(count, totalCost, totalTokens, avgLatency, errorRate, successRate);
    }

    /** Average cost per trace; 0 for an empty window. */
    public double avgCostPerTrace() {
        return count > 0 ? totalCost / count : 0.0;
    }
}
