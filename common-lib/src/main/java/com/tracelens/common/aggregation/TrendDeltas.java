package com.tracelens.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Period-over-period percentage change of the four headline metrics.
 * See {@link DashboardAggregator#percentChange(double, double)} for the zero guard.
 */
public record TrendDeltas(
    @JsonProperty("traces")  double traces,
    @JsonProperty("cost")    double cost,
    @JsonProperty("tokens")  double tokens,
    @JsonProperty("latency") double latency
) {
    public static final TrendDeltas FLAT = new TrendDeltas(0.0, 0.0, 0.0, 0.0);
}
