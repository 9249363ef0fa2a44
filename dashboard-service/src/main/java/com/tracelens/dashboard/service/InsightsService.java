package com.tracelens.dashboard.service;

import com.tracelens.common.aggregation.DashboardSummary;
import com.tracelens.common.analytics.WindowAnalysis;
import com.tracelens.common.engine.TraceInsightsEngine;
import com.tracelens.common.exception.TraceValidationException;
import com.tracelens.common.filter.FilterResult;
import com.tracelens.common.model.TimeRange;
import com.tracelens.common.model.Trace;
import com.tracelens.common.timeline.SpanNode;
import com.tracelens.common.timeline.SpanPosition;
import com.tracelens.common.transport.FetchError;
import com.tracelens.common.transport.FetchResult;
import com.tracelens.dashboard.client.TraceFeedClient;
import com.tracelens.dashboard.dto.DashboardRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Hosts {@link TraceInsightsEngine} behind reactive signatures.
 *
 * <p>Batch operations compute over records supplied by the caller. The live operations
 * read from the upstream trace API first; an upstream failure, or upstream records that
 * fail validation, come back as a failed {@link FetchResult} rather than as an error signal.
 */
@Service
public class InsightsService {

    private static final Logger log = LoggerFactory.getLogger(InsightsService.class);

    private final TraceInsightsEngine engine;
    private final TraceFeedClient traceFeedClient;
    private final Clock clock;

    public InsightsService(TraceInsightsEngine engine, TraceFeedClient traceFeedClient, Clock clock) {
        this.engine          = engine;
        this.traceFeedClient = traceFeedClient;
        this.clock           = clock;
    }

    // ── Caller-supplied batches ─────────────────────────────────────────────

    public Mono<DashboardSummary> dashboard(DashboardRequest request, String timeRange) {
        return compute("dashboard", () -> {
            DashboardSummary summary = engine.computeDashboardSummary(
                request.current(), request.previous(), timeRange);
            log.info("Dashboard computed. range={} traces={} totalCost={} errorRate={}",
                     summary.timeRange().token(), summary.totalTraces(),
                     summary.totalCost(), summary.errorRate());
            return summary;
        });
    }

    public Mono<List<SpanPosition>> timeline(Trace trace) {
        return compute("timeline", () -> {
            List<SpanPosition> positions = engine.computeTimeline(trace);
            log.info("Timeline computed. traceId={} spans={}", trace.traceId(), positions.size());
            return positions;
        });
    }

    public Mono<List<SpanNode>> callTree(Trace trace) {
        return compute("callTree", () -> engine.buildCallTree(trace));
    }

    public Mono<FilterResult> filter(List<Trace> traces, String status, String model, String query) {
        return compute("filter", () -> {
            FilterResult result = engine.filterTraces(traces, status, model, query);
            log.info("Traces filtered. status={} model={} query='{}' matched={} of={}",
                     status, model, query, result.summary().count(),
                     traces != null ? traces.size() : 0);
            return result;
        });
    }

    public Mono<WindowAnalysis> analysis(List<Trace> traces, String timeRange) {
        return compute("analysis", () -> {
            WindowAnalysis analysis = engine.analyzeWindow(traces, timeRange);
            log.info("Window analyzed. range={} rating={} insights={}",
                     analysis.timeRange().token(), analysis.performance().rating().wireValue(),
                     analysis.insights().size());
            return analysis;
        });
    }

    // ── Live, from the upstream trace API ───────────────────────────────────

    /**
     * Fetches the current and preceding windows in parallel, then summarizes them.
     *
     * @throws IllegalArgumentException (as an error signal) for an unsupported range token
     */
    public Mono<FetchResult<DashboardSummary>> liveDashboard(String timeRange) {
        TimeRange range;
        try {
            range = TimeRange.fromToken(timeRange);
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }
        Instant now = clock.instant();
        Mono<FetchResult<List<Trace>>> current  = traceFeedClient.fetchWindow(range, now);
        Mono<FetchResult<List<Trace>>> previous = traceFeedClient.fetchWindow(range, now.minus(range.window()));

        return Mono.zip(current, previous)
            .map(windows -> windows.getT1().flatMap(currentTraces ->
                windows.getT2().flatMap(previousTraces -> guarded(() ->
                    engine.computeDashboardSummary(currentTraces, previousTraces, range.token())))))
            .doOnNext(result -> {
                if (result.isSuccess()) {
                    log.info("Live dashboard computed. range={} traces={}",
                             range.token(), result.value().totalTraces());
                }
            });
    }

    public Mono<FetchResult<List<SpanPosition>>> liveTimeline(String traceId) {
        return traceFeedClient.fetchTrace(traceId)
            .map(result -> result.flatMap(trace -> guarded(() -> engine.computeTimeline(trace))))
            .doOnNext(result -> {
                if (result.isSuccess()) {
                    log.info("Live timeline computed. traceId={} spans={}", traceId, result.value().size());
                }
            });
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private <T> Mono<T> compute(String operation, Supplier<T> work) {
        return Mono.fromSupplier(work)
            .doOnError(TraceValidationException.class, e ->
                log.warn("Batch rejected. operation={} traceIndex={} traceId={} spanId={} field={}",
                         operation, e.getTraceIndex(), e.getTraceId(), e.getSpanId(), e.getField()));
    }

    /** Upstream records that break the model are an upstream failure, not a caller error. */
    private static <T> FetchResult<T> guarded(Supplier<T> work) {
        try {
            return FetchResult.success(work.get());
        } catch (TraceValidationException e) {
            log.warn("Upstream returned invalid records. traceId={} spanId={} field={}",
                     e.getTraceId(), e.getSpanId(), e.getField(), e);
            return FetchResult.failure(FetchError.of(FetchError.Kind.INVALID_RECORD, e.getMessage()));
        }
    }
}
