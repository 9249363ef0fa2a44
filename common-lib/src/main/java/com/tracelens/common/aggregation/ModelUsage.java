package com.tracelens.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Traces grouped by primary model within a window. */
public record ModelUsage(
    @JsonProperty("model") String model,
    @JsonProperty("count") long count,
    @JsonProperty("cost")  double cost
) {
    /** Average cost per trace of this model; 0 when the group is empty. */
    public double avgCost() {
        return count > 0 ? cost / count : 0.0;
    }
}
