package com.tracelens.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One model's slice of the window's total cost. {@code percentage} is 0–100. */
public record ModelCostShare(
    @JsonProperty("model")      String model,
    @JsonProperty("count")      long count,
    @JsonProperty("total_cost") double totalCost,
    @JsonProperty("percentage") double percentage
) {}
