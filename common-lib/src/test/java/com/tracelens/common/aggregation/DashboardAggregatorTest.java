package com.tracelens.common.aggregation;

import com.tracelens.common.model.TimeRange;
import com.tracelens.common.model.Trace;
import com.tracelens.common.model.TraceStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static com.tracelens.common.TraceFixtures.trace;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link DashboardAggregator}.
 * Covers headline stats, trend zero guards and the three groupings.
 */
class DashboardAggregatorTest {

    private static final double EPS = 1e-9;

    // ── compute(): headline numbers ──────────────────────────────────────

    @Nested
    @DisplayName("compute(): headline numbers")
    class ComputeTests {

        @Test
        @DisplayName("empty window → all zeros and empty groupings, no exception")
        void emptyWindow() {
            DashboardSummary summary = DashboardAggregator.compute(List.of(), List.of(), TimeRange.LAST_DAY);

            assertEquals(TimeRange.LAST_DAY, summary.timeRange());
            assertEquals(0, summary.totalTraces());
            assertEquals(0.0, summary.totalCost());
            assertEquals(0, summary.totalTokens());
            assertEquals(0.0, summary.avgLatency());
            assertEquals(0.0, summary.errorRate());
            assertEquals(0.0, summary.successRate());
            assertEquals(TrendDeltas.FLAT, summary.trends());
            assertTrue(summary.topModels().isEmpty());
            assertTrue(summary.costByDay().isEmpty());
            assertTrue(summary.tracesByStatus().isEmpty());
            assertEquals(0.0, summary.avgCostPerTrace());
        }

        @Test
        @DisplayName("null windows behave like empty ones")
        void nullWindows() {
            DashboardSummary summary = DashboardAggregator.compute(null, null, TimeRange.LAST_HOUR);
            assertEquals(0, summary.totalTraces());
        }

        @Test
        @DisplayName("one success and one error → cost 3.00, latency 200, rates 50/50")
        void successAndError() {
            List<Trace> current = List.of(
                trace("t1", "gpt-4", TraceStatus.SUCCESS, 100, 1.00, 10),
                trace("t2", "gpt-4", TraceStatus.ERROR,   300, 2.00, 20));

            DashboardSummary summary = DashboardAggregator.compute(current, List.of(), TimeRange.LAST_DAY);

            assertEquals(2, summary.totalTraces());
            assertEquals(3.00, summary.totalCost(), EPS);
            assertEquals(30, summary.totalTokens());
            assertEquals(200.0, summary.avgLatency(), EPS);
            assertEquals(50.0, summary.errorRate(), EPS);
            assertEquals(50.0, summary.successRate(), EPS);
        }

        @Test
        @DisplayName("timeout and partial count as failures")
        void nonSuccessStatusesAreFailures() {
            List<Trace> current = List.of(
                trace("t1", "gpt-4", TraceStatus.SUCCESS, 100, 0, 0),
                trace("t2", "gpt-4", TraceStatus.TIMEOUT, 100, 0, 0),
                trace("t3", "gpt-4", TraceStatus.PARTIAL, 100, 0, 0),
                trace("t4", "gpt-4", TraceStatus.SUCCESS, 100, 0, 0));

            DashboardSummary summary = DashboardAggregator.compute(current, List.of(), TimeRange.LAST_DAY);
            assertEquals(50.0, summary.errorRate(), EPS);
        }
    }

    // ── trends ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("percentChange(): trend zero guard")
    class TrendTests {

        @Test
        @DisplayName("0 → 0 is 0")
        void zeroToZero() {
            assertEquals(0.0, DashboardAggregator.percentChange(0, 0));
        }

        @Test
        @DisplayName("0 → 5 is 0, not infinity")
        void zeroToPositive() {
            assertEquals(0.0, DashboardAggregator.percentChange(0, 5));
        }

        @Test
        @DisplayName("regular growth and decline")
        void regularChange() {
            assertEquals(50.0, DashboardAggregator.percentChange(2, 3), EPS);
            assertEquals(-100.0, DashboardAggregator.percentChange(4, 0), EPS);
        }

        @Test
        @DisplayName("trends compare current against previous window per metric")
        void windowTrends() {
            List<Trace> previous = List.of(trace("p1", "gpt-4", TraceStatus.SUCCESS, 100, 1.0, 100));
            List<Trace> current  = List.of(
                trace("c1", "gpt-4", TraceStatus.SUCCESS, 150, 1.0, 100),
                trace("c2", "gpt-4", TraceStatus.SUCCESS, 150, 1.0, 100));

            TrendDeltas trends = DashboardAggregator.compute(current, previous, TimeRange.LAST_DAY).trends();

            assertEquals(100.0, trends.traces(), EPS);
            assertEquals(100.0, trends.cost(), EPS);
            assertEquals(100.0, trends.tokens(), EPS);
            assertEquals(50.0, trends.latency(), EPS);
        }

        @Test
        @DisplayName("empty previous window → flat trends")
        void emptyPrevious() {
            List<Trace> current = List.of(trace("c1", "gpt-4", TraceStatus.SUCCESS, 150, 1.0, 100));
            assertEquals(TrendDeltas.FLAT,
                DashboardAggregator.compute(current, List.of(), TimeRange.LAST_WEEK).trends());
        }
    }

    // ── groupings ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("groupings")
    class GroupingTests {

        @Test
        @DisplayName("top_models: count desc, then model asc")
        void topModelsOrder() {
            List<Trace> traces = List.of(
                trace("t1", "A", TraceStatus.SUCCESS, 10, 1, 0),
                trace("t2", "B", TraceStatus.SUCCESS, 10, 1, 0),
                trace("t3", "A", TraceStatus.SUCCESS, 10, 2, 0));

            assertEquals(List.of(new ModelUsage("A", 2, 3.0), new ModelUsage("B", 1, 1.0)),
                DashboardAggregator.topModels(traces, DashboardAggregator.TOP_MODELS_LIMIT));
        }

        @Test
        @DisplayName("top_models: equal counts tie-break by name regardless of input order")
        void topModelsTieBreak() {
            List<Trace> traces = List.of(
                trace("t1", "zeta", TraceStatus.SUCCESS, 10, 1, 0),
                trace("t2", "alpha", TraceStatus.SUCCESS, 10, 1, 0),
                trace("t3", "mid", TraceStatus.SUCCESS, 10, 1, 0));

            assertEquals(List.of("alpha", "mid", "zeta"),
                DashboardAggregator.topModels(traces, 10).stream().map(ModelUsage::model).toList());
        }

        @Test
        @DisplayName("top_models is capped")
        void topModelsCapped() {
            List<Trace> traces = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                traces.add(trace("t" + i, String.format("model-%02d", i), TraceStatus.SUCCESS, 10, 1, 0));
            }
            List<ModelUsage> top = DashboardAggregator.compute(traces, List.of(), TimeRange.LAST_DAY).topModels();

            assertEquals(DashboardAggregator.TOP_MODELS_LIMIT, top.size());
            assertEquals("model-00", top.get(0).model());
            assertEquals("model-09", top.get(9).model());
        }

        @Test
        @DisplayName("cost_by_day: observed days only, ascending")
        void costByDay() {
            List<Trace> traces = List.of(
                trace("t1", Instant.parse("2025-01-17T08:00:00Z"), "A", TraceStatus.SUCCESS, 10, 0.5, 0),
                trace("t2", Instant.parse("2025-01-15T23:00:00Z"), "A", TraceStatus.SUCCESS, 10, 1.0, 0),
                trace("t3", Instant.parse("2025-01-15T01:00:00Z"), "A", TraceStatus.SUCCESS, 10, 2.0, 0));

            List<DailyCost> days = DashboardAggregator.costByDay(traces, ZoneId.of("UTC"));

            assertEquals(2, days.size());
            assertEquals(LocalDate.of(2025, 1, 15), days.get(0).date());
            assertEquals(3.0, days.get(0).cost(), EPS);
            assertEquals(LocalDate.of(2025, 1, 17), days.get(1).date());
            assertEquals(0.5, days.get(1).cost(), EPS);
        }

        @Test
        @DisplayName("cost_by_day: day boundaries follow the requested zone")
        void costByDayZone() {
            List<Trace> traces = List.of(
                trace("t1", Instant.parse("2025-01-15T23:00:00Z"), "A", TraceStatus.SUCCESS, 10, 1.0, 0));

            List<DailyCost> days = DashboardAggregator.costByDay(traces, ZoneId.of("Asia/Tokyo"));
            assertEquals(LocalDate.of(2025, 1, 16), days.get(0).date());
        }

        @Test
        @DisplayName("traces_by_status: observed statuses, count desc, ties in status order")
        void tracesByStatus() {
            List<Trace> traces = List.of(
                trace("t1", "A", TraceStatus.TIMEOUT, 10, 0, 0),
                trace("t2", "A", TraceStatus.ERROR,   10, 0, 0),
                trace("t3", "A", TraceStatus.SUCCESS, 10, 0, 0),
                trace("t4", "A", TraceStatus.SUCCESS, 10, 0, 0));

            assertEquals(List.of(
                    new StatusCount(TraceStatus.SUCCESS, 2),
                    new StatusCount(TraceStatus.ERROR, 1),
                    new StatusCount(TraceStatus.TIMEOUT, 1)),
                DashboardAggregator.tracesByStatus(traces));
        }
    }
}
