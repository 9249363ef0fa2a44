package com.tracelens.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PerformanceReport(
    @JsonProperty("avg_latency_ms")  double avgLatencyMs,
    @JsonProperty("p50_latency_ms")  double p50LatencyMs,
    @JsonProperty("p95_latency_ms")  double p95LatencyMs,
    @JsonProperty("p99_latency_ms")  double p99LatencyMs,
    @JsonProperty("error_rate")      double errorRate,
    @JsonProperty("success_rate")    double successRate,
    @JsonProperty("rating")          PerformanceRating rating,
    @JsonProperty("recommendation")  String recommendation
) {}
