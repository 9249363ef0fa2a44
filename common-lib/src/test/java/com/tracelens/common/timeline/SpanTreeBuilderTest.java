package com.tracelens.common.timeline;

import com.tracelens.common.exception.TraceValidationException;
import com.tracelens.common.model.Trace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tracelens.common.TraceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SpanTreeBuilderTest {

    @Test
    @DisplayName("children nest under parents in sequence order")
    void buildsTree() {
        Trace trace = traceWithSpans("t1", 1000,
            span("root", null, 0, 1000),
            span("plan", "root", 0, 200),
            span("tool", "plan", 50, 100),
            span("answer", "root", 300, 600));

        List<SpanNode> roots = SpanTreeBuilder.build(trace);

        assertEquals(1, roots.size());
        SpanNode root = roots.get(0);
        assertEquals(4, root.size());
        assertEquals(List.of("plan", "answer"),
            root.children().stream().map(n -> n.span().spanId()).toList());
        SpanNode tool = root.children().get(0).children().get(0);
        assertEquals(2, tool.depth());
        assertTrue(tool.isLeaf());
    }

    @Test
    @DisplayName("unknown parent id makes the span a root")
    void orphanBecomesRoot() {
        Trace trace = traceWithSpans("t1", 1000,
            span("a", null, 0, 100),
            span("orphan", "missing", 10, 10));

        assertEquals(List.of("a", "orphan"),
            SpanTreeBuilder.build(trace).stream().map(n -> n.span().spanId()).toList());
    }

    @Test
    @DisplayName("flatten() is depth-first, parents before children")
    void flattenDepthFirst() {
        Trace trace = traceWithSpans("t1", 1000,
            span("r", null, 0, 1000),
            span("b", "r", 500, 100),
            span("a", "r", 0, 100),
            span("a1", "a", 0, 50));

        assertEquals(List.of("r", "b", "a", "a1"),
            SpanTreeBuilder.flatten(SpanTreeBuilder.build(trace)).stream()
                .map(n -> n.span().spanId()).toList());
    }

    @Test
    @DisplayName("cycle aborts with a validation error naming the loop")
    void cycleRejected() {
        Trace trace = traceWithSpans("t1", 1000,
            span("root", null, 0, 1000),
            span("a", "c", 0, 10),
            span("b", "a", 0, 10),
            span("c", "b", 0, 10));

        TraceValidationException ex = assertThrows(TraceValidationException.class,
            () -> SpanTreeBuilder.build(trace));
        assertEquals("parent_span_id", ex.getField());
        assertTrue(ex.getMessage().contains("a -> c -> b -> a"), ex.getMessage());
    }

    @Test
    @DisplayName("trace without spans → no roots")
    void empty() {
        assertTrue(SpanTreeBuilder.build(traceWithSpans("t1", 0)).isEmpty());
    }
}
