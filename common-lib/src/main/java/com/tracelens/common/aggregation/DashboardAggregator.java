package com.tracelens.common.aggregation;

import com.tracelens.common.model.TimeRange;
import com.tracelens.common.model.Trace;
import com.tracelens.common.model.TraceStatus;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the dashboard rollup for one window and its trends against the preceding window.
 *
 * <h3>Groupings</h3>
 * <ul>
 *   <li><b>top_models</b>: count desc, then model name asc; at most {@value #TOP_MODELS_LIMIT}</li>
 *   <li><b>cost_by_day</b>: observed days only, ascending; day = trace timestamp in the given zone</li>
 *   <li><b>traces_by_status</b>: observed statuses, count desc, then {@link TraceStatus} order</li>
 * </ul>
 *
 * <h3>Trend zero guard</h3>
 * <pre>
 *   previous == 0            → 0      (covers 0→0 and 0→5)
 *   otherwise                → 100 × (current − previous) / previous
 * </pre>
 *
 * <p>Inputs are assumed validated. Stateless; every grouping uses insertion-ordered or
 * sorted maps with explicit comparators, so results do not depend on hash order.
 */
public final class DashboardAggregator {

    /** Maximum number of entries in {@code top_models}. */
    public static final int TOP_MODELS_LIMIT = 10;

    private DashboardAggregator() {}

    /** UTC day bucketing. */
    public static DashboardSummary compute(List<Trace> currentWindow, List<Trace> previousWindow,
                                           TimeRange range) {
        return compute(currentWindow, previousWindow, range, ZoneOffset.UTC);
    }

    /**
     * @param currentWindow  validated traces inside the selected window
     * @param previousWindow validated traces inside the preceding window of equal length
     * @param range          window selector echoed on the summary
     * @param zone           timezone used to truncate timestamps to calendar days
     * @return the summary; never null, never NaN/Infinity
     */
    public static DashboardSummary compute(List<Trace> currentWindow, List<Trace> previousWindow,
                                           TimeRange range, ZoneId zone) {
        List<Trace> current  = currentWindow  != null ? currentWindow  : List.of();
        List<Trace> previous = previousWindow != null ? previousWindow : List.of();

        WindowStats now  = WindowStats.of(current);
        WindowStats then = WindowStats.of(previous);

        TrendDeltas trends = new TrendDeltas(
            percentChange(then.count(),       now.count()),
            percentChange(then.totalCost(),   now.totalCost()),
            percentChange(then.totalTokens(), now.totalTokens()),
            percentChange(then.avgLatency(),  now.avgLatency()));

        return new DashboardSummary(
            range,
            now.count(),
            now.totalCost(),
            now.totalTokens(),
            now.avgLatency(),
            now.errorRate(),
            now.successRate(),
            trends,
            topModels(current, TOP_MODELS_LIMIT),
            costByDay(current, zone),
            tracesByStatus(current));
    }

    // ── Trends ─────────────────────────────────────────────────────

    /**
     * Percentage change from {@code previous} to {@code current}; 0 when {@code previous} is 0.
     */
    public static double percentChange(double previous, double current) {
        if (previous == 0.0) return 0.0;
        double change = 100.0 * (current - previous) / previous;
        return Double.isFinite(change) ? change : 0.0;
    }

    // ── Groupings ──────────────────────────────────────────────────

    /** Groups by model; count desc, model asc, truncated to {@code limit}. */
    public static List<ModelUsage> topModels(List<Trace> traces, int limit) {
        Map<String, long[]> counts = new LinkedHashMap<>();
        Map<String, Double> costs = new LinkedHashMap<>();
        for (Trace trace : traces) {
            counts.computeIfAbsent(trace.model(), k -> new long[1])[0]++;
            costs.merge(trace.model(), trace.totalCostUsd(), Double::sum);
        }

        List<ModelUsage> usage = new ArrayList<>(counts.size());
        counts.forEach((model, count) -> usage.add(new ModelUsage(model, count[0], costs.get(model))));
        usage.sort(Comparator.comparingLong(ModelUsage::count).reversed()
                             .thenComparing(ModelUsage::model));
        return Collections.unmodifiableList(usage.size() > limit ? new ArrayList<>(usage.subList(0, limit)) : usage);
    }

    /** Sums cost per calendar day of each trace's own timestamp; only observed days appear. */
    public static List<DailyCost> costByDay(List<Trace> traces, ZoneId zone) {
        Map<LocalDate, Double> byDay = new TreeMap<>();
        for (Trace trace : traces) {
            LocalDate day = trace.timestamp().atZone(zone).toLocalDate();
            byDay.merge(day, trace.totalCostUsd(), Double::sum);
        }
        List<DailyCost> days = new ArrayList<>(byDay.size());
        byDay.forEach((day, cost) -> days.add(new DailyCost(day, cost)));
        return Collections.unmodifiableList(days);
    }

    /** Counts per observed status; count desc, ties in {@link TraceStatus} declaration order. */
    public static List<StatusCount> tracesByStatus(List<Trace> traces) {
        Map<TraceStatus, Long> byStatus = new EnumMap<>(TraceStatus.class);
        for (Trace trace : traces) {
            byStatus.merge(trace.status(), 1L, Long::sum);
        }
        List<StatusCount> counts = new ArrayList<>(byStatus.size());
        byStatus.forEach((status, count) -> counts.add(new StatusCount(status, count)));
        // List.sort is stable, so equal counts keep enum order from the EnumMap
        counts.sort(Comparator.comparingLong(StatusCount::count).reversed());
        return Collections.unmodifiableList(counts);
    }
}
