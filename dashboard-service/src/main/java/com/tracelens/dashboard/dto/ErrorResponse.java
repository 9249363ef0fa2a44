package com.tracelens.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.exception.TraceValidationException;
import com.tracelens.common.transport.FetchError;

import java.time.Instant;

/**
 * Error body for every non-2xx answer. Validation failures name the offending record;
 * upstream failures carry the {@link FetchError}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error")       String error,
    @JsonProperty("message")     String message,
    @JsonProperty("trace_index") Integer traceIndex,
    @JsonProperty("trace_id")    String traceId,
    @JsonProperty("span_id")     String spanId,
    @JsonProperty("field")       String field,
    @JsonProperty("upstream")    FetchError upstream,
    @JsonProperty("timestamp")   Instant timestamp
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, null, null, null, null, Instant.now());
    }

    public static ErrorResponse validation(TraceValidationException e) {
        return new ErrorResponse("validation_failed", e.getMessage(),
            e.getTraceIndex() >= 0 ? e.getTraceIndex() : null,
            e.getTraceId(), e.getSpanId(), e.getField(), null, Instant.now());
    }

    public static ErrorResponse upstream(FetchError error) {
        return new ErrorResponse("upstream_unavailable", error.message(),
            null, null, null, null, error, Instant.now());
    }
}
