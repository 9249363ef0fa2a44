package com.tracelens.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Cost picture of one window.
 *
 * <p>{@code mostExpensiveModel} is null and {@code highestCost} 0 for an empty window.
 */
public record CostAnalysis(
    @JsonProperty("total_cost")           double totalCost,
    @JsonProperty("daily_average")        double dailyAverage,
    @JsonProperty("monthly_projection")   double monthlyProjection,
    @JsonProperty("cost_breakdown")       List<ModelCostShare> costBreakdown,
    @JsonProperty("cost_by_provider")     List<ProviderCost> costByProvider,
    @JsonProperty("most_expensive_model") String mostExpensiveModel,
    @JsonProperty("highest_cost")         double highestCost
) {}
