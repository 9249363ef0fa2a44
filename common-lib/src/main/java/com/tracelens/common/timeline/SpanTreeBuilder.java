package com.tracelens.common.timeline;

import com.tracelens.common.exception.TraceValidationException;
import com.tracelens.common.model.Span;
import com.tracelens.common.model.Trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the parent/child call tree of a trace from the {@code parent_span_id} relation.
 *
 * <p>The relation is an id reference, not an ownership link, and upstream does not
 * guarantee it is acyclic. Every walk tracks the ids it has visited and raises a
 * {@link TraceValidationException} on field {@code parent_span_id} instead of looping.
 *
 * <p>Spans without a parent, or whose parent id does not match any span in the trace,
 * become roots. Roots and siblings keep the trace's span sequence order.
 */
public final class SpanTreeBuilder {

    private SpanTreeBuilder() {}

    /**
     * @param trace a validated trace
     * @return root nodes in sequence order; empty for a trace without spans
     * @throws TraceValidationException when the parent relation contains a cycle
     */
    public static List<SpanNode> build(Trace trace) {
        if (trace.spanCount() == 0) return List.of();
        checkAcyclic(trace, -1);

        Map<String, Span> byId = new LinkedHashMap<>();
        for (Span span : trace.spans()) {
            byId.put(span.spanId(), span);
        }

        Map<String, List<Span>> childrenByParent = new HashMap<>();
        List<Span> roots = new ArrayList<>();
        for (Span span : trace.spans()) {
            String parentId = span.parentSpanId();
            if (parentId == null || !byId.containsKey(parentId)) {
                roots.add(span);
            } else {
                childrenByParent.computeIfAbsent(parentId, k -> new ArrayList<>()).add(span);
            }
        }

        Set<String> visited = new HashSet<>();
        List<SpanNode> nodes = new ArrayList<>(roots.size());
        for (Span root : roots) {
            nodes.add(toNode(trace, root, 0, childrenByParent, visited));
        }
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Depth-first flattening of {@link #build(Trace)}: parents before children,
     * siblings in sequence order.
     */
    public static List<SpanNode> flatten(List<SpanNode> roots) {
        List<SpanNode> ordered = new ArrayList<>();
        for (SpanNode root : roots) {
            appendDepthFirst(root, ordered);
        }
        return ordered;
    }

    /**
     * Walks each span's ancestor chain and fails on the first id seen twice in one walk.
     * Chains already proven acyclic are not walked again, so the check is linear.
     *
     * @param traceIndex position of the trace in its batch, or -1
     * @throws TraceValidationException when a cycle is found
     */
    public static void checkAcyclic(Trace trace, int traceIndex) {
        if (trace.spanCount() == 0) return;

        Map<String, String> parentOf = new HashMap<>();
        for (Span span : trace.spans()) {
            parentOf.put(span.spanId(), span.parentSpanId());
        }

        Set<String> acyclic = new HashSet<>();
        for (Span span : trace.spans()) {
            Set<String> path = new LinkedHashSet<>();
            String current = span.spanId();
            while (current != null && !acyclic.contains(current)) {
                if (!path.add(current)) {
                    throw new TraceValidationException(traceIndex, trace.traceId(), current,
                        "parent_span_id", "forms a cycle: " + String.join(" -> ", path) + " -> " + current);
                }
                current = parentOf.get(current);
            }
            acyclic.addAll(path);
        }
    }

    private static SpanNode toNode(Trace trace, Span span, int depth,
                                   Map<String, List<Span>> childrenByParent, Set<String> visited) {
        if (!visited.add(span.spanId())) {
            throw new TraceValidationException(trace.traceId(), span.spanId(),
                "parent_span_id", "span reached twice while building the call tree");
        }
        List<Span> children = childrenByParent.getOrDefault(span.spanId(), List.of());
        List<SpanNode> childNodes = new ArrayList<>(children.size());
        for (Span child : children) {
            childNodes.add(toNode(trace, child, depth + 1, childrenByParent, visited));
        }
        return new SpanNode(span, depth, Collections.unmodifiableList(childNodes));
    }

    private static void appendDepthFirst(SpanNode node, List<SpanNode> ordered) {
        ordered.add(node);
        for (SpanNode child : node.children()) {
            appendDepthFirst(child, ordered);
        }
    }
}
