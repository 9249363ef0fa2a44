package com.tracelens.common.validation;

import com.tracelens.common.model.Trace;

import java.util.List;

/**
 * Output of {@link TraceValidator}: normalized, immutable traces in their original order
 * plus the non-fatal duration warnings observed while checking them.
 */
public record ValidatedBatch(
    List<Trace> traces,
    List<DurationDiscrepancy> warnings
) {
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public static ValidatedBatch empty() {
        return new ValidatedBatch(List.of(), List.of());
    }
}
