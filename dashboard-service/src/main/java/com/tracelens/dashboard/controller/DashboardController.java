package com.tracelens.dashboard.controller;

import com.tracelens.common.transport.FetchError;
import com.tracelens.common.transport.FetchResult;
import com.tracelens.dashboard.dto.ErrorResponse;
import com.tracelens.dashboard.service.InsightsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Live views backed by the upstream trace API. A failed fetch answers 502 (404 when the
 * upstream reports the trace missing) with the {@link FetchError}; no substitute data is served.
 */
@RestController
@RequestMapping("/api/v1")
public class DashboardController {

    private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

    private final InsightsService insightsService;

    public DashboardController(InsightsService insightsService) {
        this.insightsService = insightsService;
    }

    @GetMapping("/dashboard")
    public Mono<ResponseEntity<?>> dashboard(
            @RequestParam(name = "time_range", defaultValue = "24h") String timeRange) {
        log.info("Live dashboard query received. range={}", timeRange);
        return insightsService.liveDashboard(timeRange)
            .map(DashboardController::toResponse);
    }

    @GetMapping("/traces/{traceId}/timeline")
    public Mono<ResponseEntity<?>> timeline(@PathVariable String traceId) {
        log.info("Live timeline query received. traceId={}", traceId);
        return insightsService.liveTimeline(traceId)
            .map(DashboardController::toResponse);
    }

    private static <T> ResponseEntity<?> toResponse(FetchResult<T> result) {
        return result.<ResponseEntity<?>>fold(
            ResponseEntity::ok,
            error -> ResponseEntity.status(statusFor(error)).body(ErrorResponse.upstream(error)));
    }

    static HttpStatus statusFor(FetchError error) {
        if (error.kind() == FetchError.Kind.HTTP_STATUS
                && error.status() != null && error.status() == HttpStatus.NOT_FOUND.value()) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}
