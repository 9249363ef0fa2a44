package com.tracelens.dashboard.client;

import com.tracelens.common.model.TimeRange;
import com.tracelens.common.model.Trace;
import com.tracelens.common.transport.FetchError;
import com.tracelens.common.transport.FetchResult;
import com.tracelens.dashboard.client.dto.TraceEnvelope;
import com.tracelens.dashboard.client.dto.TracePage;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.codec.CodecException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Read-only client for the upstream trace API.
 *
 * <p>Every call completes with a {@link FetchResult}: transport, status and decoding
 * failures become a {@link FetchError} and are never replaced by placeholder traces.
 * Listing follows {@code offset}/{@code limit} pagination until the upstream total is
 * reached or {@code max-traces} records have been read.
 */
@Component
public class TraceFeedClient {

    private static final Logger log = LoggerFactory.getLogger(TraceFeedClient.class);

    private final WebClient traceFeedWebClient;
    private final String organizationId;
    private final String projectId;
    private final int pageSize;
    private final int maxTraces;

    public TraceFeedClient(WebClient traceFeedWebClient,
                           @Value("${tracelens.feed.organization-id}") String organizationId,
                           @Value("${tracelens.feed.project-id}") String projectId,
                           @Value("${tracelens.feed.page-size:100}") int pageSize,
                           @Value("${tracelens.feed.max-traces:10000}") int maxTraces) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("tracelens.feed.page-size must be positive: " + pageSize);
        }
        this.traceFeedWebClient = traceFeedWebClient;
        this.organizationId     = organizationId;
        this.projectId          = projectId;
        this.pageSize           = pageSize;
        this.maxTraces          = maxTraces;
    }

    /**
     * Reads every trace whose timestamp falls in {@code [windowEnd − range, windowEnd)}.
     *
     * @return the traces in upstream order, or the reason they could not be read
     */
    public Mono<FetchResult<List<Trace>>> fetchWindow(TimeRange range, Instant windowEnd) {
        Instant windowStart = windowEnd.minus(range.window());
        return fetchPage(windowStart, windowEnd, 0)
            .expand(cursor -> {
                long nextOffset = cursor.offset() + cursor.page().traces().size();
                boolean more = !cursor.page().traces().isEmpty()
                    && nextOffset < cursor.page().totalCount()
                    && nextOffset < maxTraces;
                return more ? fetchPage(windowStart, windowEnd, nextOffset) : Mono.empty();
            })
            .concatMapIterable(cursor -> cursor.page().traces())
            .take(maxTraces)
            .collectList()
            .doOnNext(traces -> log.info("Trace window fetched. range={} start={} end={} traces={}",
                                         range.token(), windowStart, windowEnd, traces.size()))
            .map(FetchResult::success)
            .onErrorResume(e -> {
                FetchError error = toFetchError(e);
                log.warn("Trace window fetch failed. range={} start={} kind={} status={}",
                         range.token(), windowStart, error.kind(), error.status(), e);
                return Mono.just(FetchResult.failure(error));
            });
    }

    /** Reads one trace with its spans. */
    public Mono<FetchResult<Trace>> fetchTrace(String traceId) {
        return traceFeedWebClient.get()
            .uri("/api/v1/traces/{id}", traceId)
            .retrieve()
            .bodyToMono(TraceEnvelope.class)
            .map(envelope -> envelope.data() != null
                ? FetchResult.success(envelope.data())
                : FetchResult.<Trace>failure(FetchError.of(FetchError.Kind.DECODE,
                    "response for trace " + traceId + " carried no data")))
            .onErrorResume(e -> {
                FetchError error = toFetchError(e);
                log.warn("Trace fetch failed. traceId={} kind={} status={}",
                         traceId, error.kind(), error.status(), e);
                return Mono.just(FetchResult.failure(error));
            });
    }

    private Mono<PageCursor> fetchPage(Instant start, Instant end, long offset) {
        return traceFeedWebClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/traces")
                .queryParam("organization_id", organizationId)
                .queryParam("project_id", projectId)
                .queryParam("start_time", DateTimeFormatter.ISO_INSTANT.format(start))
                .queryParam("end_time", DateTimeFormatter.ISO_INSTANT.format(end))
                .queryParam("limit", pageSize)
                .queryParam("offset", offset)
                .build())
            .retrieve()
            .bodyToMono(TracePage.class)
            .map(page -> new PageCursor(offset, page));
    }

    private record PageCursor(long offset, TracePage page) {}

    static FetchError toFetchError(Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            return FetchError.httpStatus(wcre.getStatusCode().value(),
                "upstream answered " + wcre.getStatusCode().value());
        }
        if (hasCause(e, TimeoutException.class) || hasCause(e, ReadTimeoutException.class)) {
            return FetchError.of(FetchError.Kind.TIMEOUT, "upstream did not answer in time");
        }
        if (e instanceof CodecException) {
            return FetchError.of(FetchError.Kind.DECODE, "unreadable upstream body: " + e.getMessage());
        }
        if (e instanceof WebClientRequestException) {
            return FetchError.of(FetchError.Kind.CONNECTION, "upstream unreachable: " + e.getMessage());
        }
        return FetchError.of(FetchError.Kind.CONNECTION, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }
}
