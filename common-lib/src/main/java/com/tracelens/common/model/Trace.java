package com.tracelens.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One end-to-end unit of LLM work (e.g. a single user request) and its spans.
 *
 * <p>{@code spans} keeps upstream insertion order, which is discovery order and not
 * necessarily start-time order. A trace with no spans is valid.
 *
 * <p>Durations, token counts and costs are required on the wire; a missing value is a
 * read error, never a zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Trace(
    @JsonProperty("trace_id")        String traceId,
    @JsonProperty("organization_id") String organizationId,
    @JsonProperty("project_id")      String projectId,
    @JsonProperty("timestamp")       Instant timestamp,
    @JsonProperty("trace_type")      String traceType,
    @JsonProperty(value = "duration_ms", required = true)     long durationMs,
    @JsonProperty("status")          TraceStatus status,
    @JsonProperty(value = "total_cost_usd", required = true)  double totalCostUsd,
    @JsonProperty(value = "total_tokens", required = true)    long totalTokens,
    @JsonProperty("model")           String model,
    @JsonProperty("provider")        String provider,
    @JsonProperty("user_id")         String userId,
    @JsonProperty("metadata")        Map<String, Object> metadata,
    @JsonProperty("spans")           List<Span> spans
) {
    /** Number of spans; zero for leaf-only traces. */
    public int spanCount() {
        return spans == null ? 0 : spans.size();
    }

    /** Returns a copy of this trace carrying the given spans. */
    public Trace withSpans(List<Span> newSpans) {
        return new Trace(traceId, organizationId, projectId, timestamp, traceType, durationMs,
                         status, totalCostUsd, totalTokens, model, provider, userId, metadata,
                         newSpans);
    }
}
