package com.tracelens.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-model cost/latency profile. {@code efficiencyScore} is lower-is-better:
 * {@code avgLatency / 1000 + avgCostPerRequest × 100}.
 */
public record ModelComparison(
    @JsonProperty("model")                  String model,
    @JsonProperty("total_calls")            long totalCalls,
    @JsonProperty("total_cost")             double totalCost,
    @JsonProperty("avg_cost_per_request")   double avgCostPerRequest,
    @JsonProperty("avg_latency")            double avgLatency,
    @JsonProperty("avg_tokens_per_request") double avgTokensPerRequest,
    @JsonProperty("efficiency_score")       double efficiencyScore
) {}
