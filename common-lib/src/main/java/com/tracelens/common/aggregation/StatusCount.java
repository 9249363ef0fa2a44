package com.tracelens.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.model.TraceStatus;

public record StatusCount(
    @JsonProperty("status") TraceStatus status,
    @JsonProperty("count")  long count
) {}
