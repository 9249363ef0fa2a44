package com.tracelens.common.engine;

import com.tracelens.common.aggregation.DashboardAggregator;
import com.tracelens.common.aggregation.DashboardSummary;
import com.tracelens.common.analytics.WindowAnalysis;
import com.tracelens.common.analytics.WindowAnalyzer;
import com.tracelens.common.exception.TraceValidationException;
import com.tracelens.common.filter.FilterResult;
import com.tracelens.common.filter.TraceCatalog;
import com.tracelens.common.filter.TraceFilter;
import com.tracelens.common.model.TimeRange;
import com.tracelens.common.model.Trace;
import com.tracelens.common.timeline.SpanNode;
import com.tracelens.common.timeline.SpanPosition;
import com.tracelens.common.timeline.SpanTreeBuilder;
import com.tracelens.common.timeline.TimelineLayoutEngine;
import com.tracelens.common.validation.DurationDiscrepancy;
import com.tracelens.common.validation.TraceValidator;
import com.tracelens.common.validation.ValidatedBatch;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Entry point used by the presentation layer.
 *
 * <p>Every operation validates its raw input with {@link TraceValidator} before delegating;
 * a {@link TraceValidationException} means nothing was computed. Duration discrepancies do
 * not fail the call; they are handed to the warning sink so the host can log them.
 *
 * <p>Instances hold only the day-bucketing zone and the sink, and are safe to share.
 */
public final class TraceInsightsEngine {

    private final ZoneId zone;
    private final Consumer<DurationDiscrepancy> warningSink;

    public TraceInsightsEngine(ZoneId zone, Consumer<DurationDiscrepancy> warningSink) {
        this.zone        = Objects.requireNonNull(zone, "zone");
        this.warningSink = Objects.requireNonNull(warningSink, "warningSink");
    }

    /** UTC bucketing, warnings dropped. */
    public static TraceInsightsEngine defaults() {
        return new TraceInsightsEngine(ZoneOffset.UTC, d -> { });
    }

    public ZoneId zone() {
        return zone;
    }

    // ── Dashboard ──────────────────────────────────────────────────

    /**
     * @param currentWindow  raw traces inside the selected window
     * @param previousWindow raw traces inside the preceding window of equal length
     * @param rangeToken     one of {@code 1h|24h|7d|30d|90d} (aliases accepted)
     * @throws IllegalArgumentException  when {@code rangeToken} is not supported
     * @throws TraceValidationException  when either window holds an invalid record
     */
    public DashboardSummary computeDashboardSummary(List<Trace> currentWindow,
                                                    List<Trace> previousWindow,
                                                    String rangeToken) {
        TimeRange range = TimeRange.fromToken(rangeToken);
        List<Trace> current  = validated(currentWindow);
        List<Trace> previous = validated(previousWindow);
        return DashboardAggregator.compute(current, previous, range, zone);
    }

    // ── Timeline ───────────────────────────────────────────────────

    /** Positions in span sequence order; see {@link TimelineLayoutEngine}. */
    public List<SpanPosition> computeTimeline(Trace trace) {
        return TimelineLayoutEngine.layout(validated(trace));
    }

    /** Parent/child call tree of the trace's spans; cycles are rejected by validation. */
    public List<SpanNode> buildCallTree(Trace trace) {
        return SpanTreeBuilder.build(validated(trace));
    }

    // ── Listing ────────────────────────────────────────────────────

    /**
     * @param statusFilter {@code "all"} or a status wire value
     * @param modelFilter  {@code "all"} or an exact model name
     * @param query        free text; blank matches everything
     */
    public FilterResult filterTraces(List<Trace> traces, String statusFilter,
                                     String modelFilter, String query) {
        return catalog(traces).filter(new TraceFilter(statusFilter, modelFilter, query));
    }

    /** Validated, reusable source for repeated filtering of the same batch. */
    public TraceCatalog catalog(List<Trace> traces) {
        return TraceCatalog.of(validated(traces));
    }

    // ── Analysis ───────────────────────────────────────────────────

    /** Cost, performance, per-model comparison and insights for one window. */
    public WindowAnalysis analyzeWindow(List<Trace> traces, String rangeToken) {
        TimeRange range = TimeRange.fromToken(rangeToken);
        return WindowAnalyzer.analyze(validated(traces), range);
    }

    // ── Validation ─────────────────────────────────────────────────

    private List<Trace> validated(List<Trace> traces) {
        return report(TraceValidator.validate(traces)).traces();
    }

    private Trace validated(Trace trace) {
        return report(TraceValidator.validate(trace)).traces().get(0);
    }

    private ValidatedBatch report(ValidatedBatch batch) {
        batch.warnings().forEach(warningSink);
        return batch;
    }
}
