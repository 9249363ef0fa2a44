package com.tracelens.common.filter;

import com.tracelens.common.model.Trace;

/**
 * Listing criteria. {@code status} and {@code model} are either {@value #ALL} (or null/blank)
 * or an exact value; {@code query} is a case-insensitive substring, empty matches everything.
 */
public record TraceFilter(
    String status,
    String model,
    String query
) {
    public static final String ALL = "all";

    public static TraceFilter all() {
        return new TraceFilter(ALL, ALL, "");
    }

    public boolean matchesStatus(Trace trace) {
        return isAll(status) || trace.status().wireValue().equals(status);
    }

    public boolean matchesModel(Trace trace) {
        return isAll(model) || model.equals(trace.model());
    }

    public boolean matchesQuery(Trace trace) {
        return TraceFilterEngine.matchesQuery(trace, query);
    }

    /** Status, then model, then free text; all three must hold. */
    public boolean matches(Trace trace) {
        return matchesStatus(trace) && matchesModel(trace) && matchesQuery(trace);
    }

    private static boolean isAll(String value) {
        return value == null || value.isBlank() || ALL.equals(value);
    }
}
