package com.tracelens.common.analytics;

import com.tracelens.common.aggregation.WindowStats;
import com.tracelens.common.model.TimeRange;
import com.tracelens.common.model.Trace;

import java.util.List;

/** Runs every window analyzer over the same validated traces and bundles the results. */
public final class WindowAnalyzer {

    private WindowAnalyzer() {}

    public static WindowAnalysis analyze(List<Trace> traces, TimeRange range) {
        List<Trace> window = traces != null ? traces : List.of();

        WindowStats stats                = WindowStats.of(window);
        CostAnalysis cost                = CostAnalyzer.analyze(window, range);
        PerformanceReport performance    = PerformanceAnalyzer.analyze(window);
        List<ModelComparison> models     = ModelComparator.compare(window);
        List<Insight> insights           = InsightGenerator.generate(stats, performance, cost, models);

        return new WindowAnalysis(range, cost, performance, models, insights);
    }
}
