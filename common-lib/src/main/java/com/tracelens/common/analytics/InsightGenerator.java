package com.tracelens.common.analytics;

import com.tracelens.common.aggregation.WindowStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based insights over an analyzed window. Rules fire independently, in this order:
 *
 * <pre>
 *   reliability   error rate &gt; 5%  → warning/high     (else &gt; 1% → info/medium)
 *   cost          top model share &gt; 80%               → info/low
 *   performance   p95 latency &gt; 2000ms                → warning/medium
 *   cost          avg cost per trace &gt; $0.01          → info/low
 *   reliability   success rate &gt; 99%                  → success/info
 *   usage         most used model &gt; 100 calls         → info/info
 *   efficiency    first model averaging &gt; 2000 tokens  → info/low
 *   optimization  single model &gt; 50 calls → info/low; ≥ 3 models → success/info
 * </pre>
 */
public final class InsightGenerator {

    static final double HIGH_ERROR_RATE       = 5.0;
    static final double ELEVATED_ERROR_RATE   = 1.0;
    static final double COST_CONCENTRATION    = 80.0;
    static final double HIGH_P95_LATENCY_MS   = 2000.0;
    static final double HIGH_AVG_COST         = 0.01;
    static final double EXCELLENT_SUCCESS     = 99.0;
    static final long   HIGH_USAGE_CALLS      = 100;
    static final double HIGH_TOKENS_PER_CALL  = 2000.0;
    static final long   SINGLE_MODEL_CALLS    = 50;
    static final int    DIVERSE_MODEL_COUNT   = 3;

    private InsightGenerator() {}

    public static List<Insight> generate(WindowStats stats,
                                         PerformanceReport performance,
                                         CostAnalysis cost,
                                         List<ModelComparison> models) {
        List<Insight> insights = new ArrayList<>();

        if (stats.errorRate() > HIGH_ERROR_RATE) {
            insights.add(new Insight("warning", "reliability", "High Error Rate",
                format("Error rate is %.2f%%, which is above the recommended 5%% threshold", stats.errorRate()),
                "high"));
        } else if (stats.errorRate() > ELEVATED_ERROR_RATE) {
            insights.add(new Insight("info", "reliability", "Elevated Error Rate",
                format("Error rate is %.2f%%, consider investigating recent changes", stats.errorRate()),
                "medium"));
        }

        if (!cost.costBreakdown().isEmpty()
                && cost.costBreakdown().get(0).percentage() > COST_CONCENTRATION) {
            ModelCostShare top = cost.costBreakdown().get(0);
            insights.add(new Insight("info", "cost", "Cost Concentration",
                format("%.1f%% of costs come from %s. Consider model optimization or caching",
                       top.percentage(), top.model()),
                "low"));
        }

        if (performance.p95LatencyMs() > HIGH_P95_LATENCY_MS) {
            insights.add(new Insight("warning", "performance", "High P95 Latency",
                format("P95 latency is %.0fms. Users may experience slow responses", performance.p95LatencyMs()),
                "medium"));
        }

        if (stats.avgCostPerTrace() > HIGH_AVG_COST) {
            insights.add(new Insight("info", "cost", "High Average Cost",
                format("Average cost per request is $%.4f. Consider optimizing prompts or using cheaper models",
                       stats.avgCostPerTrace()),
                "low"));
        }

        if (stats.successRate() > EXCELLENT_SUCCESS) {
            insights.add(new Insight("success", "reliability", "Excellent Reliability",
                format("Success rate is %.2f%% - great job!", stats.successRate()),
                "info"));
        }

        if (!models.isEmpty()) {
            ModelComparison mostUsed = models.get(0);
            if (mostUsed.totalCalls() > HIGH_USAGE_CALLS) {
                insights.add(new Insight("info", "usage", "High Model Usage",
                    format("%s is your most used model with %d calls. Ensure you're getting the best value",
                           mostUsed.model(), mostUsed.totalCalls()),
                    "info"));
            }

            for (ModelComparison model : models) {
                if (model.avgTokensPerRequest() > HIGH_TOKENS_PER_CALL) {
                    insights.add(new Insight("info", "efficiency", "High Token Usage",
                        format("%s averages %.0f tokens per call. Consider prompt optimization",
                               model.model(), model.avgTokensPerRequest()),
                        "low"));
                    break;
                }
            }
        }

        if (models.size() == 1 && models.get(0).totalCalls() > SINGLE_MODEL_CALLS) {
            insights.add(new Insight("info", "optimization", "Single Model Usage",
                format("You're only using %s. Consider testing other models for cost/performance optimization",
                       models.get(0).model()),
                "low"));
        } else if (models.size() >= DIVERSE_MODEL_COUNT) {
            insights.add(new Insight("success", "optimization", "Good Model Diversity",
                format("Using %d different models - great job optimizing for different use cases!", models.size()),
                "info"));
        }

        return Collections.unmodifiableList(insights);
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
