package com.tracelens.common.timeline;

import com.tracelens.common.model.Span;
import com.tracelens.common.model.Trace;
import com.tracelens.common.validation.TraceValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Maps each span's temporal extent onto a normalized 0–100 horizontal band of its trace.
 *
 * <h3>Layout rules</h3>
 * <pre>
 *   start = 100 × (span.start_time − trace.timestamp) / trace.duration_ms, clamped to [0, 100]
 *   width = 100 × span.duration_ms / trace.duration_ms, clamped to [0, 100 − start]
 *   trace.duration_ms == 0  → every span gets start = 0, width = 100
 * </pre>
 *
 * <p>Spans that start before the trace (clock skew) pin to {@code start = 0}. The output
 * keeps the trace's span sequence; use {@link #chronological(List)} for start order.
 *
 * <p>Pure function over a validated trace; safe to call concurrently.
 */
public final class TimelineLayoutEngine {

    private static final double FULL_WIDTH = 100.0;

    private TimelineLayoutEngine() {}

    /**
     * @param trace a validated trace
     * @return one position per span, in the trace's span order; empty when it has no spans
     */
    public static List<SpanPosition> layout(Trace trace) {
        if (trace.spanCount() == 0) return List.of();

        long totalMs = trace.durationMs();
        long traceStart = trace.timestamp().toEpochMilli();

        List<SpanPosition> positions = new ArrayList<>(trace.spanCount());
        for (Span span : trace.spans()) {
            double start;
            double width;
            if (totalMs <= 0) {
                start = 0.0;
                width = FULL_WIDTH;
            } else {
                long offsetMs = span.startTime().toEpochMilli() - traceStart;
                start = clamp(FULL_WIDTH * offsetMs / totalMs, 0.0, FULL_WIDTH);
                width = clamp(FULL_WIDTH * span.durationMs() / totalMs, 0.0, FULL_WIDTH - start);
                // FULL_WIDTH - start can round up by one ulp
                while (width > 0.0 && start + width > FULL_WIDTH) {
                    width = Math.nextDown(width);
                }
            }
            positions.add(new SpanPosition(
                span.spanId(), span.name(), span.model(), span.status(), span.durationMs(),
                start, width, TraceValidator.isDurationInconsistent(span)));
        }
        return Collections.unmodifiableList(positions);
    }

    /** Stable re-sort by {@code startPercent}; spans that start together keep sequence order. */
    public static List<SpanPosition> chronological(List<SpanPosition> positions) {
        List<SpanPosition> sorted = new ArrayList<>(positions);
        sorted.sort(Comparator.comparingDouble(SpanPosition::startPercent));
        return Collections.unmodifiableList(sorted);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(value, max));
    }
}
