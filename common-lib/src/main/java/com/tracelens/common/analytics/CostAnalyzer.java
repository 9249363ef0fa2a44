package com.tracelens.common.analytics;

import com.tracelens.common.model.TimeRange;
import com.tracelens.common.model.Trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Breaks a window's spend down by model and provider and projects it forward.
 *
 * <pre>
 *   dailyAverage      = totalCost / windowDays      (1h window → 1/24 day)
 *   monthlyProjection = dailyAverage × 30
 *   share percentage  = 100 × modelCost / totalCost (0 when totalCost = 0)
 * </pre>
 *
 * <p>Breakdowns are ordered by cost desc, then name asc.
 */
public final class CostAnalyzer {

    private static final int PROJECTION_DAYS = 30;

    private CostAnalyzer() {}

    public static CostAnalysis analyze(List<Trace> traces, TimeRange range) {
        double totalCost = 0.0;
        Map<String, double[]> byModel = new LinkedHashMap<>();     // [cost, count]
        Map<String, double[]> byProvider = new LinkedHashMap<>();  // [cost, count]
        for (Trace trace : traces) {
            totalCost += trace.totalCostUsd();
            accumulate(byModel, trace.model(), trace.totalCostUsd());
            accumulate(byProvider, trace.provider(), trace.totalCostUsd());
        }

        List<ModelCostShare> breakdown = new ArrayList<>(byModel.size());
        for (Map.Entry<String, double[]> e : byModel.entrySet()) {
            double cost = e.getValue()[0];
            double percentage = totalCost > 0.0 ? 100.0 * cost / totalCost : 0.0;
            breakdown.add(new ModelCostShare(e.getKey(), (long) e.getValue()[1], cost, percentage));
        }
        breakdown.sort(Comparator.comparingDouble(ModelCostShare::totalCost).reversed()
                                 .thenComparing(ModelCostShare::model));

        List<ProviderCost> providers = new ArrayList<>(byProvider.size());
        byProvider.forEach((provider, acc) -> providers.add(new ProviderCost(provider, acc[0], (long) acc[1])));
        providers.sort(Comparator.comparingDouble(ProviderCost::totalCost).reversed()
                                 .thenComparing(ProviderCost::provider));

        double dailyAverage = totalCost / range.windowDays();
        String mostExpensive = breakdown.isEmpty() ? null : breakdown.get(0).model();
        double highestCost   = breakdown.isEmpty() ? 0.0  : breakdown.get(0).totalCost();

        return new CostAnalysis(
            totalCost,
            dailyAverage,
            dailyAverage * PROJECTION_DAYS,
            Collections.unmodifiableList(breakdown),
            Collections.unmodifiableList(providers),
            mostExpensive,
            highestCost);
    }

    private static void accumulate(Map<String, double[]> acc, String key, double cost) {
        double[] slot = acc.computeIfAbsent(key, k -> new double[2]);
        slot[0] += cost;
        slot[1] += 1;
    }
}
