package com.tracelens.dashboard.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracelens.common.engine.TraceInsightsEngine;
import com.tracelens.common.model.Span;
import com.tracelens.common.model.Trace;
import com.tracelens.common.model.TraceStatus;
import com.tracelens.dashboard.UpstreamStub;
import com.tracelens.dashboard.dto.DashboardRequest;
import com.tracelens.dashboard.service.InsightsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Consumer;

import static com.tracelens.dashboard.UpstreamStub.MAPPER;
import static com.tracelens.dashboard.UpstreamStub.trace;

/**
 * HTTP contract of the batch endpoints, bound to the real engine.
 */
class InsightsControllerTest {

    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        UpstreamStub unused = new UpstreamStub(req -> Mono.error(new AssertionError("upstream must not be called")));
        InsightsService service = new InsightsService(
            TraceInsightsEngine.defaults(), unused.client(10), Clock.fixed(T0, ZoneOffset.UTC));

        webTestClient = WebTestClient
            .bindToController(new InsightsController(service))
            .controllerAdvice(new InsightsExceptionHandler())
            .httpMessageCodecs(c -> {
                c.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(MAPPER));
                c.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(MAPPER));
            })
            .build();
    }

    private WebTestClient.ResponseSpec post(String uri, Object body) {
        return webTestClient.post().uri(uri)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange();
    }

    /** A one-trace dashboard body with the trace's JSON edited before sending. */
    private static String dashboardBodyWith(Consumer<ObjectNode> edit) {
        ObjectNode trace = MAPPER.valueToTree(trace("t1", T0, TraceStatus.SUCCESS, 100, 1.00));
        edit.accept(trace);
        ObjectNode body = MAPPER.createObjectNode();
        body.putArray("current").add(trace);
        body.putArray("previous");
        return body.toString();
    }

    // ── /dashboard ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/insights/dashboard")
    class DashboardTests {

        @Test
        @DisplayName("computes headline numbers over the current window")
        void computesSummary() {
            DashboardRequest request = new DashboardRequest(List.of(
                trace("t1", T0, TraceStatus.SUCCESS, 100, 1.00),
                trace("t2", T0, TraceStatus.ERROR,   300, 2.00)), List.of());

            post("/api/v1/insights/dashboard?time_range=24h", request)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.time_range").isEqualTo("24h")
                .jsonPath("$.total_traces").isEqualTo(2)
                .jsonPath("$.total_cost").isEqualTo(3.0)
                .jsonPath("$.avg_latency").isEqualTo(200.0)
                .jsonPath("$.error_rate").isEqualTo(50.0)
                .jsonPath("$.success_rate").isEqualTo(50.0)
                .jsonPath("$.cost_by_day[0].date").isEqualTo("2025-01-15")
                .jsonPath("$.traces_by_status[0].status").isEqualTo("success");
        }

        @Test
        @DisplayName("empty windows → zeros")
        void emptyWindows() {
            post("/api/v1/insights/dashboard?time_range=7d", new DashboardRequest(null, null))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total_traces").isEqualTo(0)
                .jsonPath("$.trends.cost").isEqualTo(0.0)
                .jsonPath("$.top_models").isEmpty();
        }

        @Test
        @DisplayName("unknown range → 400")
        void badRange() {
            post("/api/v1/insights/dashboard?time_range=2w", new DashboardRequest(List.of(), List.of()))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");
        }

        @Test
        @DisplayName("invalid record → 422 naming record and field")
        void invalidRecord() {
            DashboardRequest request = new DashboardRequest(List.of(
                trace("ok", T0, TraceStatus.SUCCESS, 100, 1.0),
                trace("bad", T0, TraceStatus.SUCCESS, -1, 1.0)), List.of());

            post("/api/v1/insights/dashboard", request)
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("validation_failed")
                .jsonPath("$.trace_index").isEqualTo(1)
                .jsonPath("$.trace_id").isEqualTo("bad")
                .jsonPath("$.field").isEqualTo("duration_ms");
        }

        @Test
        @DisplayName("unknown status in the body → 400")
        void unreadableBody() {
            String body = "{\"current\":[{\"trace_id\":\"t1\",\"status\":\"exploded\"}]}";
            post("/api/v1/insights/dashboard", body)
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("trace without total_cost_usd → 400, not a zero-cost trace")
        void missingCost() {
            post("/api/v1/insights/dashboard", dashboardBodyWith(t -> t.remove("total_cost_usd")))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");
        }

        @Test
        @DisplayName("null duration_ms → 400")
        void nullDuration() {
            post("/api/v1/insights/dashboard", dashboardBodyWith(t -> t.putNull("duration_ms")))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");
        }

        @Test
        @DisplayName("span without cost_usd → 400")
        void spanMissingCost() {
            String body = dashboardBodyWith(t -> {
                ObjectNode span = MAPPER.valueToTree(Span.of("s1", null, "call", T0, T0.plusMillis(100), 100,
                    "gpt-4", "openai", 1, 1, 2, 0.01, TraceStatus.SUCCESS, null));
                span.remove("cost_usd");
                t.putArray("spans").add(span);
            });
            post("/api/v1/insights/dashboard", body)
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("complete edited body is still accepted")
        void completeBodyAccepted() {
            post("/api/v1/insights/dashboard", dashboardBodyWith(t -> t.put("user_id", "alice")))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total_cost").isEqualTo(1.0);
        }
    }

    // ── /timeline and /call-tree ──────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/insights/timeline")
    class TimelineTests {

        private Span span(String id, String parent, long offsetMs, long durationMs) {
            Instant start = T0.plusMillis(offsetMs);
            return Span.of(id, parent, "call", start, start.plusMillis(durationMs), durationMs,
                           "gpt-4", "openai", 1, 1, 2, 0.0, TraceStatus.SUCCESS, null);
        }

        @Test
        @DisplayName("percentages in span order")
        void positions() {
            Trace trace = trace("t1", T0, TraceStatus.SUCCESS, 1000, 0.1)
                .withSpans(List.of(span("root", null, 0, 1000), span("child", "root", 500, 250)));

            post("/api/v1/insights/timeline", trace)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].span_id").isEqualTo("root")
                .jsonPath("$[1].start_percent").isEqualTo(50.0)
                .jsonPath("$[1].width_percent").isEqualTo(25.0)
                .jsonPath("$[1].duration_inconsistent").isEqualTo(false);
        }

        @Test
        @DisplayName("zero-duration trace → full-width spans")
        void zeroDuration() {
            Trace trace = trace("t1", T0, TraceStatus.SUCCESS, 0, 0.1)
                .withSpans(List.of(span("a", null, 0, 0), span("b", null, 0, 0), span("c", null, 0, 0)));

            post("/api/v1/insights/timeline", trace)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(3)
                .jsonPath("$[2].start_percent").isEqualTo(0.0)
                .jsonPath("$[2].width_percent").isEqualTo(100.0);
        }

        @Test
        @DisplayName("cyclic parents → 422 instead of a hang")
        void cycle() {
            Trace trace = trace("t1", T0, TraceStatus.SUCCESS, 1000, 0.1)
                .withSpans(List.of(span("a", "b", 0, 10), span("b", "a", 0, 10)));

            post("/api/v1/insights/call-tree", trace)
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.field").isEqualTo("parent_span_id");
        }

        @Test
        @DisplayName("call tree nests children")
        void callTree() {
            Trace trace = trace("t1", T0, TraceStatus.SUCCESS, 1000, 0.1)
                .withSpans(List.of(span("root", null, 0, 1000), span("child", "root", 500, 250)));

            post("/api/v1/insights/call-tree", trace)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].span.span_id").isEqualTo("root")
                .jsonPath("$[0].children[0].depth").isEqualTo(1);
        }
    }

    // ── /traces/filter and /analysis ──────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/insights/traces/filter and /analysis")
    class ListingTests {

        private final List<Trace> traces = List.of(
            trace("t1", T0, TraceStatus.SUCCESS, 100, 1.0),
            trace("t2", T0, TraceStatus.ERROR,   300, 2.0),
            trace("t3", T0, TraceStatus.SUCCESS, 200, 3.0));

        @Test
        @DisplayName("defaults pass everything through")
        void passThrough() {
            post("/api/v1/insights/traces/filter", traces)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.summary.count").isEqualTo(3)
                .jsonPath("$.traces[2].trace_id").isEqualTo("t3")
                .jsonPath("$.available_statuses[0]").isEqualTo("success")
                .jsonPath("$.available_statuses[1]").isEqualTo("error");
        }

        @Test
        @DisplayName("status and free text")
        void filtered() {
            post("/api/v1/insights/traces/filter?status=success&q=T3", traces)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.summary.count").isEqualTo(1)
                .jsonPath("$.summary.total_cost").isEqualTo(3.0)
                .jsonPath("$.available_models[0]").isEqualTo("gpt-4");
        }

        @Test
        @DisplayName("analysis bundles cost, performance and insights")
        void analysis() {
            post("/api/v1/insights/analysis?time_range=30d", traces)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.time_range").isEqualTo("30d")
                .jsonPath("$.cost.total_cost").isEqualTo(6.0)
                .jsonPath("$.cost.daily_average").isEqualTo(0.2)
                .jsonPath("$.performance.rating").isEqualTo("poor")
                .jsonPath("$.models[0].total_calls").isEqualTo(3);
        }
    }
}
