package com.tracelens.common.timeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tracelens.common.model.Span;

import java.util.List;

/**
 * One span in a trace's call tree. {@code depth} is 0 for roots.
 * Children keep the trace's span sequence order.
 */
public record SpanNode(
    Span span,
    int depth,
    List<SpanNode> children
) {
    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Number of nodes in this subtree, including this one. */
    public int size() {
        int size = 1;
        for (SpanNode child : children) {
            size += child.size();
        }
        return size;
    }
}
