package com.tracelens.dashboard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelens.common.model.Trace;
import com.tracelens.common.model.TraceStatus;
import com.tracelens.dashboard.client.TraceFeedClient;
import com.tracelens.dashboard.client.dto.TraceEnvelope;
import com.tracelens.dashboard.client.dto.TracePage;
import com.tracelens.dashboard.config.DashboardConfig;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory stand-in for the upstream trace API: a {@link WebClient} whose exchange
 * function answers from a handler and records every request it saw.
 */
public final class UpstreamStub {

    public static final ObjectMapper MAPPER = DashboardConfig.newObjectMapper();

    public static final ExchangeStrategies STRATEGIES = ExchangeStrategies.builder()
        .codecs(c -> {
            c.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(MAPPER));
            c.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(MAPPER));
        })
        .build();

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final Function<ClientRequest, Mono<ClientResponse>> handler;

    public UpstreamStub(Function<ClientRequest, Mono<ClientResponse>> handler) {
        this.handler = handler;
    }

    public TraceFeedClient client(int pageSize) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return handler.apply(request);
        };
        WebClient webClient = WebClient.builder()
            .baseUrl("http://upstream.test")
            .exchangeStrategies(STRATEGIES)
            .exchangeFunction(exchange)
            .build();
        return new TraceFeedClient(webClient, "org-1", "proj-1", pageSize, 1000);
    }

    public List<ClientRequest> requests() {
        return requests;
    }

    // ── Responses ───────────────────────────────────────────────────────────

    public static Mono<ClientResponse> json(HttpStatus status, Object body) {
        try {
            return Mono.just(ClientResponse.create(status, STRATEGIES)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body instanceof String s ? s : MAPPER.writeValueAsString(body))
                .build());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Mono<ClientResponse> page(List<Trace> traces, long total, int page, int pageSize) {
        int pages = (int) ((total + pageSize - 1) / pageSize);
        return json(HttpStatus.OK, new TracePage(traces, total, page, pageSize, pages));
    }

    public static Mono<ClientResponse> envelope(Trace trace) {
        return json(HttpStatus.OK, new TraceEnvelope(true, trace));
    }

    public static String queryParam(ClientRequest request, String name) {
        return UriComponentsBuilder.fromUri(request.url()).build().getQueryParams().getFirst(name);
    }

    // ── Records ─────────────────────────────────────────────────────────────

    public static Trace trace(String id, Instant timestamp, TraceStatus status, long durationMs, double cost) {
        return new Trace(id, "org-1", "proj-1", timestamp, "chat", durationMs, status,
                         cost, 100, "gpt-4", "openai", null, null, List.of());
    }
}
