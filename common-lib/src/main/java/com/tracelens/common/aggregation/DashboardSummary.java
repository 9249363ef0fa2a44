package com.tracelens.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.model.TimeRange;

import java.util.List;

/**
 * Dashboard rollup of the current window with trends against the preceding window.
 * All numeric fields are finite; an empty window yields zeros and empty groupings.
 */
public record DashboardSummary(
    @JsonProperty("time_range")       TimeRange timeRange,
    @JsonProperty("total_traces")     long totalTraces,
    @JsonProperty("total_cost")       double totalCost,
    @JsonProperty("total_tokens")     long totalTokens,
    @JsonProperty("avg_latency")      double avgLatency,
    @JsonProperty("error_rate")       double errorRate,
    @JsonProperty("success_rate")     double successRate,
    @JsonProperty("trends")           TrendDeltas trends,
    @JsonProperty("top_models")       List<ModelUsage> topModels,
    @JsonProperty("cost_by_day")      List<DailyCost> costByDay,
    @JsonProperty("traces_by_status") List<StatusCount> tracesByStatus
) {
    /** Average cost per trace in the current window; 0 when the window is empty. */
    public double avgCostPerTrace() {
        return totalTraces > 0 ? totalCost / totalTraces : 0.0;
    }
}
