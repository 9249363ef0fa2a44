package com.tracelens.common.analytics;

import com.tracelens.common.model.Trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares models used in a window. Every per-request average divides by the model's
 * call count, which is at least 1 for any model that appears, so no average is undefined.
 * Ordered by calls desc, then model asc (same order as the dashboard's top models).
 */
public final class ModelComparator {

    private ModelComparator() {}

    public static List<ModelComparison> compare(List<Trace> traces) {
        Map<String, List<Trace>> byModel = new LinkedHashMap<>();
        for (Trace trace : traces) {
            byModel.computeIfAbsent(trace.model(), k -> new ArrayList<>()).add(trace);
        }

        List<ModelComparison> comparisons = new ArrayList<>(byModel.size());
        for (Map.Entry<String, List<Trace>> entry : byModel.entrySet()) {
            List<Trace> group = entry.getValue();
            long calls = group.size();
            double totalCost = 0.0;
            long totalTokens = 0;
            long totalLatency = 0;
            for (Trace trace : group) {
                totalCost    += trace.totalCostUsd();
                totalTokens  += trace.totalTokens();
                totalLatency += trace.durationMs();
            }
            double avgCost    = calls > 0 ? totalCost / calls : 0.0;
            double avgTokens  = calls > 0 ? (double) totalTokens / calls : 0.0;
            double avgLatency = calls > 0 ? (double) totalLatency / calls : 0.0;

            comparisons.add(new ModelComparison(
                entry.getKey(), calls, totalCost, avgCost, avgLatency, avgTokens,
                avgLatency / 1000.0 + avgCost * 100.0));
        }

        comparisons.sort(Comparator.comparingLong(ModelComparison::totalCalls).reversed()
                                   .thenComparing(ModelComparison::model));
        return Collections.unmodifiableList(comparisons);
    }
}
