package com.tracelens.common.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Non-fatal warning: a span's {@code end_time - start_time} disagrees with its declared
 * {@code duration_ms} beyond the validator tolerance. The declared value stays authoritative.
 */
public record DurationDiscrepancy(
    @JsonProperty("trace_id")            String traceId,
    @JsonProperty("span_id")             String spanId,
    @JsonProperty("declared_duration_ms") long declaredDurationMs,
    @JsonProperty("measured_duration_ms") long measuredDurationMs
) {
    /** Signed gap, declared minus measured. */
    public long deltaMs() {
        return declaredDurationMs - measuredDurationMs;
    }
}
