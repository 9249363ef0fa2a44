package com.tracelens.common.filter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.aggregation.WindowStats;

/** Stats of the filtered subset, computed with the same zero guards as the dashboard. */
public record FilterSummary(
    @JsonProperty("count")        long count,
    @JsonProperty("total_cost")   double totalCost,
    @JsonProperty("avg_latency")  double avgLatency,
    @JsonProperty("success_rate") double successRate
) {
    public static FilterSummary from(WindowStats stats) {
        return new FilterSummary(stats.count(), stats.totalCost(), stats.avgLatency(), stats.successRate());
    }
}
