package com.tracelens.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProviderCost(
    @JsonProperty("provider")   String provider,
    @JsonProperty("total_cost") double totalCost,
    @JsonProperty("count")      long count
) {}
