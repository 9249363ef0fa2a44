package com.tracelens.common.validation;

import com.tracelens.common.exception.TraceValidationException;
import com.tracelens.common.model.Span;
import com.tracelens.common.model.Trace;
import com.tracelens.common.model.TraceStatus;
import com.tracelens.common.timeline.SpanTreeBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes raw trace records into the canonical shapes consumed by the engines and
 * rejects any batch containing a record that breaks a model invariant.
 *
 * <h3>Rejected (first violation wins, batch fails as a unit)</h3>
 * <ul>
 *   <li>blank {@code trace_id}, {@code organization_id}, {@code project_id},
 *       {@code model} or {@code provider}; missing {@code timestamp} or {@code status}</li>
 *   <li>negative {@code duration_ms}, {@code total_tokens}; negative or non-finite cost</li>
 *   <li>span: blank or duplicate {@code span_id}, missing start/end, {@code end_time}
 *       before {@code start_time}, negative tokens/duration/cost, missing status,
 *       {@code error_message} on a successful span</li>
 *   <li>a cycle in the {@code parent_span_id} relation</li>
 * </ul>
 *
 * <h3>Normalized</h3>
 * <p>Blank optional strings become {@code null}; null span lists and metadata become
 * empty; collections are copied into unmodifiable views.
 *
 * <h3>Reported, not rejected</h3>
 * <p>Spans whose measured extent differs from {@code duration_ms} by more than
 * {@value #DURATION_TOLERANCE_MS} ms are listed in {@link ValidatedBatch#warnings()}.
 */
public final class TraceValidator {

    /** Allowed gap between {@code end_time - start_time} and {@code duration_ms}. */
    public static final long DURATION_TOLERANCE_MS = 1L;

    private TraceValidator() {}

    /**
     * Validates a whole batch.
     *
     * @param traces raw records in upstream order; null is treated as an empty batch
     * @return normalized traces in the same order plus duration warnings; never null
     * @throws TraceValidationException on the first invariant violation
     */
    public static ValidatedBatch validate(List<Trace> traces) {
        if (traces == null || traces.isEmpty()) return ValidatedBatch.empty();

        List<Trace> normalized = new ArrayList<>(traces.size());
        List<DurationDiscrepancy> warnings = new ArrayList<>();
        for (int i = 0; i < traces.size(); i++) {
            normalized.add(normalizeTrace(traces.get(i), i, warnings));
        }
        return new ValidatedBatch(Collections.unmodifiableList(normalized),
                                  Collections.unmodifiableList(warnings));
    }

    /** Validates a single trace outside of any batch (trace index reported as -1). */
    public static ValidatedBatch validate(Trace trace) {
        List<DurationDiscrepancy> warnings = new ArrayList<>();
        Trace normalized = normalizeTrace(trace, -1, warnings);
        return new ValidatedBatch(List.of(normalized), Collections.unmodifiableList(warnings));
    }

    /**
     * True when the span's timestamps disagree with its declared duration beyond tolerance.
     * Spans without both timestamps are never flagged.
     */
    public static boolean isDurationInconsistent(Span span) {
        if (span.startTime() == null || span.endTime() == null) return false;
        return Math.abs(span.measuredDurationMs() - span.durationMs()) > DURATION_TOLERANCE_MS;
    }

    // ── Trace level ────────────────────────────────────────────────

    private static Trace normalizeTrace(Trace raw, int index, List<DurationDiscrepancy> warnings) {
        if (raw == null) {
            throw new TraceValidationException(index, null, null, "trace", "record is null");
        }
        String traceId = raw.traceId();
        requireText(raw.traceId(),        index, traceId, null, "trace_id");
        requireText(raw.organizationId(), index, traceId, null, "organization_id");
        requireText(raw.projectId(),      index, traceId, null, "project_id");
        requireText(raw.model(),          index, traceId, null, "model");
        requireText(raw.provider(),       index, traceId, null, "provider");

        if (raw.timestamp() == null) {
            throw new TraceValidationException(index, traceId, null, "timestamp", "is required");
        }
        if (raw.status() == null) {
            throw new TraceValidationException(index, traceId, null, "status", "is required");
        }
        requireNonNegative(raw.durationMs(),  index, traceId, null, "duration_ms");
        requireNonNegative(raw.totalTokens(), index, traceId, null, "total_tokens");
        requireCost(raw.totalCostUsd(),       index, traceId, null, "total_cost_usd");

        List<Span> spans = normalizeSpans(raw, index, warnings);

        Trace normalized = new Trace(
            traceId, raw.organizationId(), raw.projectId(), raw.timestamp(),
            blankToNull(raw.traceType()), raw.durationMs(), raw.status(),
            raw.totalCostUsd(), raw.totalTokens(), raw.model(), raw.provider(),
            blankToNull(raw.userId()), copyMetadata(raw.metadata()), spans);

        SpanTreeBuilder.checkAcyclic(normalized, index);
        return normalized;
    }

    // ── Span level ─────────────────────────────────────────────────

    private static List<Span> normalizeSpans(Trace raw, int index, List<DurationDiscrepancy> warnings) {
        if (raw.spans() == null || raw.spans().isEmpty()) return List.of();

        String traceId = raw.traceId();
        Set<String> seenIds = new HashSet<>();
        List<Span> spans = new ArrayList<>(raw.spans().size());

        for (Span span : raw.spans()) {
            if (span == null) {
                throw new TraceValidationException(index, traceId, null, "spans", "contains a null span");
            }
            String spanId = span.spanId();
            requireText(spanId, index, traceId, null, "span_id");
            if (!seenIds.add(spanId)) {
                throw new TraceValidationException(index, traceId, spanId, "span_id",
                    "is not unique within the trace");
            }
            if (span.startTime() == null) {
                throw new TraceValidationException(index, traceId, spanId, "start_time", "is required");
            }
            if (span.endTime() == null) {
                throw new TraceValidationException(index, traceId, spanId, "end_time", "is required");
            }
            if (span.endTime().isBefore(span.startTime())) {
                throw new TraceValidationException(index, traceId, spanId, "end_time",
                    "precedes start_time");
            }
            if (span.status() == null) {
                throw new TraceValidationException(index, traceId, spanId, "status", "is required");
            }
            requireNonNegative(span.durationMs(),       index, traceId, spanId, "duration_ms");
            requireNonNegative(span.promptTokens(),     index, traceId, spanId, "prompt_tokens");
            requireNonNegative(span.completionTokens(), index, traceId, spanId, "completion_tokens");
            requireNonNegative(span.totalTokens(),      index, traceId, spanId, "total_tokens");
            requireCost(span.costUsd(),                 index, traceId, spanId, "cost_usd");

            String errorMessage = blankToNull(span.errorMessage());
            if (errorMessage != null && span.status() == TraceStatus.SUCCESS) {
                throw new TraceValidationException(index, traceId, spanId, "error_message",
                    "is only allowed on failed spans");
            }

            Span normalized = new Span(
                spanId, traceId, blankToNull(span.parentSpanId()), span.name(),
                span.startTime(), span.endTime(), span.durationMs(),
                span.model(), span.provider(), span.input(), span.output(),
                span.promptTokens(), span.completionTokens(), span.totalTokens(),
                span.costUsd(), span.status(), errorMessage, copyMetadata(span.metadata()));

            if (isDurationInconsistent(normalized)) {
                warnings.add(new DurationDiscrepancy(traceId, spanId,
                    normalized.durationMs(), normalized.measuredDurationMs()));
            }
            spans.add(normalized);
        }
        return Collections.unmodifiableList(spans);
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static void requireText(String value, int index, String traceId, String spanId, String field) {
        if (value == null || value.isBlank()) {
            throw new TraceValidationException(index, traceId, spanId, field, "must not be blank");
        }
    }

    private static void requireNonNegative(long value, int index, String traceId, String spanId, String field) {
        if (value < 0) {
            throw new TraceValidationException(index, traceId, spanId, field,
                "must be non-negative but was " + value);
        }
    }

    private static void requireCost(double value, int index, String traceId, String spanId, String field) {
        if (!Double.isFinite(value) || value < 0) {
            throw new TraceValidationException(index, traceId, spanId, field,
                "must be a finite non-negative amount but was " + value);
        }
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }

    private static Map<String, Object> copyMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return Map.of();
        // LinkedHashMap tolerates null values, Map.copyOf does not
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
