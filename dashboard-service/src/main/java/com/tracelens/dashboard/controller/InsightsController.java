package com.tracelens.dashboard.controller;

import com.tracelens.common.aggregation.DashboardSummary;
import com.tracelens.common.analytics.WindowAnalysis;
import com.tracelens.common.filter.FilterResult;
import com.tracelens.common.model.Trace;
import com.tracelens.common.timeline.SpanNode;
import com.tracelens.common.timeline.SpanPosition;
import com.tracelens.dashboard.dto.DashboardRequest;
import com.tracelens.dashboard.service.InsightsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Stateless computations over records the caller already holds.
 * Invalid records answer 422, unsupported ranges 400; see {@link InsightsExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/insights")
public class InsightsController {

    private static final Logger log = LoggerFactory.getLogger(InsightsController.class);

    private final InsightsService insightsService;

    public InsightsController(InsightsService insightsService) {
        this.insightsService = insightsService;
    }

    @PostMapping("/dashboard")
    public Mono<ResponseEntity<DashboardSummary>> dashboard(
            @RequestParam(name = "time_range", defaultValue = "24h") String timeRange,
            @RequestBody DashboardRequest request) {
        log.info("Dashboard request received. range={}", timeRange);
        return insightsService.dashboard(request, timeRange)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/timeline")
    public Mono<ResponseEntity<List<SpanPosition>>> timeline(@RequestBody Trace trace) {
        log.info("Timeline request received. traceId={}", trace.traceId());
        return insightsService.timeline(trace)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/call-tree")
    public Mono<ResponseEntity<List<SpanNode>>> callTree(@RequestBody Trace trace) {
        log.info("Call tree request received. traceId={}", trace.traceId());
        return insightsService.callTree(trace)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/traces/filter")
    public Mono<ResponseEntity<FilterResult>> filter(
            @RequestParam(defaultValue = "all") String status,
            @RequestParam(defaultValue = "all") String model,
            @RequestParam(name = "q", defaultValue = "") String query,
            @RequestBody List<Trace> traces) {
        log.info("Filter request received. status={} model={} traces={}", status, model, traces.size());
        return insightsService.filter(traces, status, model, query)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/analysis")
    public Mono<ResponseEntity<WindowAnalysis>> analysis(
            @RequestParam(name = "time_range", defaultValue = "24h") String timeRange,
            @RequestBody List<Trace> traces) {
        log.info("Analysis request received. range={} traces={}", timeRange, traces.size());
        return insightsService.analysis(traces, timeRange)
            .map(ResponseEntity::ok);
    }
}
