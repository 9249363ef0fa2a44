package com.tracelens.common.timeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.model.TraceStatus;

/**
 * Horizontal placement of one span inside its trace's timeline, as percentages of the
 * trace duration. {@code startPercent + widthPercent} never exceeds 100.
 *
 * <p>{@code durationInconsistent} flags spans whose timestamps disagree with the declared
 * duration; the declared duration was still used for the width.
 */
public record SpanPosition(
    @JsonProperty("span_id")               String spanId,
    @JsonProperty("name")                  String name,
    @JsonProperty("model")                 String model,
    @JsonProperty("status")                TraceStatus status,
    @JsonProperty("duration_ms")           long durationMs,
    @JsonProperty("start_percent")         double startPercent,
    @JsonProperty("width_percent")         double widthPercent,
    @JsonProperty("duration_inconsistent") boolean durationInconsistent
) {
    public double endPercent() {
        return startPercent + widthPercent;
    }
}
