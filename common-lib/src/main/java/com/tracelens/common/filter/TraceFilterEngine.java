package com.tracelens.common.filter;

import com.tracelens.common.model.Trace;

import java.util.List;
import java.util.Locale;

/**
 * Categorical filtering and free-text search over a trace collection.
 *
 * <p>Processing order is status, then model, then free text (logical AND). The free-text
 * query is matched verbatim, case-insensitively, as a substring of {@code trace_id},
 * {@code model}, the status wire value and {@code user_id} when present; any one field
 * matching is enough.
 */
public final class TraceFilterEngine {

    private TraceFilterEngine() {}

    /** One-shot filter; callers that re-filter the same source should keep a {@link TraceCatalog}. */
    public static FilterResult filter(List<Trace> traces, TraceFilter criteria) {
        return TraceCatalog.of(traces).filter(criteria);
    }

    public static FilterResult filter(List<Trace> traces, String status, String model, String query) {
        return filter(traces, new TraceFilter(status, model, query));
    }

    /** True when {@code query} is empty or found in any searchable field of {@code trace}. */
    public static boolean matchesQuery(Trace trace, String query) {
        if (query == null || query.isEmpty()) return true;
        String needle = query.toLowerCase(Locale.ROOT);

        return contains(trace.traceId(), needle)
            || contains(trace.model(), needle)
            || contains(trace.status().wireValue(), needle)
            || contains(trace.userId(), needle);
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }
}
