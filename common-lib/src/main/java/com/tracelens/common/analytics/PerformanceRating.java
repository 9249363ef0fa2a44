package com.tracelens.common.analytics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall latency/reliability grade of a window.
 *
 * <pre>
 *   EXCELLENT  p95 &lt; 500ms  and error rate &lt; 1%
 *   GOOD       p95 &lt; 1000ms and error rate &lt; 5%
 *   FAIR       p95 &lt; 2000ms and error rate &lt; 10%
 *   POOR       anything worse
 *   NO_DATA    the window holds no traces
 * </pre>
 */
public enum PerformanceRating {
    EXCELLENT("Performance is optimal. Continue monitoring."),
    GOOD("Performance is acceptable but could be improved."),
    FAIR("Performance issues detected. Consider optimization."),
    POOR("Critical performance issues. Immediate attention required."),
    NO_DATA("No traces in the selected window.");

    private final String recommendation;

    PerformanceRating(String recommendation) {
        this.recommendation = recommendation;
    }

    public String recommendation() {
        return recommendation;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PerformanceRating rate(long traceCount, double p95LatencyMs, double errorRate) {
        if (traceCount == 0)                             return NO_DATA;
        if (p95LatencyMs < 500  && errorRate < 1.0)      return EXCELLENT;
        if (p95LatencyMs < 1000 && errorRate < 5.0)      return GOOD;
        if (p95LatencyMs < 2000 && errorRate < 10.0)     return FAIR;
        return POOR;
    }
}
