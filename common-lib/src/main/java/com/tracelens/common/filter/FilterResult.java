package com.tracelens.common.filter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.model.Trace;
import com.tracelens.common.model.TraceStatus;

import java.util.List;

/**
 * Filtered traces in source order, their summary, and the filter choices available in the
 * unfiltered source.
 */
public record FilterResult(
    @JsonProperty("traces")             List<Trace> traces,
    @JsonProperty("summary")            FilterSummary summary,
    @JsonProperty("available_models")   List<String> availableModels,
    @JsonProperty("available_statuses") List<TraceStatus> availableStatuses
) {}
