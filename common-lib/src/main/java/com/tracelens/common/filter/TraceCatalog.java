package com.tracelens.common.filter;

import com.tracelens.common.aggregation.WindowStats;
import com.tracelens.common.model.Trace;
import com.tracelens.common.model.TraceStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable source collection for the trace listing.
 *
 * <p>The distinct models and statuses are derived once, when the catalog is built from a
 * new source, and reused by every {@link #filter(TraceFilter)} call. Changing the filter
 * never recomputes them; changing the source means building a new catalog.
 */
public final class TraceCatalog {

    private final List<Trace> traces;
    private final List<String> availableModels;
    private final List<TraceStatus> availableStatuses;

    private TraceCatalog(List<Trace> traces) {
        this.traces = Collections.unmodifiableList(new ArrayList<>(traces));

        Set<String> models = new TreeSet<>();
        Set<TraceStatus> statuses = EnumSet.noneOf(TraceStatus.class);
        for (Trace trace : this.traces) {
            models.add(trace.model());
            statuses.add(trace.status());
        }
        this.availableModels   = List.copyOf(models);
        this.availableStatuses = List.copyOf(statuses);
    }

    /** @param traces validated traces; null is an empty source */
    public static TraceCatalog of(List<Trace> traces) {
        return new TraceCatalog(traces != null ? traces : List.of());
    }

    /** Applies {@code criteria} and summarizes the matches; source order is preserved. */
    public FilterResult filter(TraceFilter criteria) {
        TraceFilter effective = criteria != null ? criteria : TraceFilter.all();

        List<Trace> matches = new ArrayList<>();
        for (Trace trace : traces) {
            if (effective.matches(trace)) matches.add(trace);
        }
        return new FilterResult(
            Collections.unmodifiableList(matches),
            FilterSummary.from(WindowStats.of(matches)),
            availableModels,
            availableStatuses);
    }

    public List<Trace> traces() {
        return traces;
    }

    /** Distinct models of the source, ascending. */
    public List<String> availableModels() {
        return availableModels;
    }

    /** Distinct statuses of the source, in {@link TraceStatus} order. */
    public List<TraceStatus> availableStatuses() {
        return availableStatuses;
    }

    public int size() {
        return traces.size();
    }
}
