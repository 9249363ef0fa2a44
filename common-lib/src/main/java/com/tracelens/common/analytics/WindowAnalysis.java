package com.tracelens.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.model.TimeRange;

import java.util.List;

/** Cost, performance, per-model and insight views of one window, computed together. */
public record WindowAnalysis(
    @JsonProperty("time_range")  TimeRange timeRange,
    @JsonProperty("cost")        CostAnalysis cost,
    @JsonProperty("performance") PerformanceReport performance,
    @JsonProperty("models")      List<ModelComparison> models,
    @JsonProperty("insights")    List<Insight> insights
) {}
