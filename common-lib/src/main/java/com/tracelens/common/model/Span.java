package com.tracelens.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * A single model invocation or sub-operation within a {@link Trace}.
 *
 * <p>{@code durationMs} is authoritative for layout and aggregation even when it disagrees
 * with {@code endTime - startTime}; the validator reports such spans instead of rewriting them.
 * {@code totalTokens} is reported independently by upstream and is not required to equal
 * {@code promptTokens + completionTokens}.
 *
 * <p>Durations, token counts and costs are required on the wire; a missing value is a
 * read error, never a zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Span(
    @JsonProperty("span_id")           String spanId,
    @JsonProperty("trace_id")          String traceId,
    @JsonProperty("parent_span_id")    String parentSpanId,
    @JsonProperty("name")              String name,
    @JsonProperty("start_time")        Instant startTime,
    @JsonProperty("end_time")          Instant endTime,
    @JsonProperty(value = "duration_ms", required = true)       long durationMs,
    @JsonProperty("model")             String model,
    @JsonProperty("provider")          String provider,
    @JsonProperty("input")             String input,
    @JsonProperty("output")            String output,
    @JsonProperty(value = "prompt_tokens", required = true)     long promptTokens,
    @JsonProperty(value = "completion_tokens", required = true) long completionTokens,
    @JsonProperty(value = "total_tokens", required = true)      long totalTokens,
    @JsonProperty(value = "cost_usd", required = true)          double costUsd,
    @JsonProperty("status")            TraceStatus status,
    @JsonProperty("error_message")     String errorMessage,
    @JsonProperty("metadata")          Map<String, Object> metadata
) {
    /** True when the span has no parent reference. */
    @JsonIgnore
    public boolean isRoot() {
        return parentSpanId == null;
    }

    /** Wall-clock extent derived from the timestamps, in milliseconds. */
    public long measuredDurationMs() {
        return endTime.toEpochMilli() - startTime.toEpochMilli();
    }

    /** Compact factory for the common case without payloads or metadata. */
    public static Span of(String spanId, String parentSpanId, String name,
                          Instant startTime, Instant endTime, long durationMs,
                          String model, String provider,
                          long promptTokens, long completionTokens, long totalTokens,
                          double costUsd, TraceStatus status, String errorMessage) {
        return new Span(spanId, null, parentSpanId, name, startTime, endTime, durationMs,
                        model, provider, null, null,
                        promptTokens, completionTokens, totalTokens,
                        costUsd, status, errorMessage, null);
    }
}
