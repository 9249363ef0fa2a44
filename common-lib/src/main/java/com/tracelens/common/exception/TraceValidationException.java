package com.tracelens.common.exception;

/**
 * A raw trace record failed a model invariant. The whole batch it belongs to is rejected.
 *
 * <p>Carries the position of the offending record in its batch, its trace id, the span id
 * when the violation is inside a span, and the wire name of the field at fault.
 */
public class TraceValidationException extends RuntimeException {

    private final int traceIndex;
    private final String traceId;
    private final String spanId;
    private final String field;

    public TraceValidationException(int traceIndex, String traceId, String spanId,
                                    String field, String message) {
        super(describe(traceIndex, traceId, spanId, field) + " " + message);
        this.traceIndex = traceIndex;
        this.traceId    = traceId;
        this.spanId     = spanId;
        this.field      = field;
    }

    public TraceValidationException(String traceId, String spanId, String field, String message) {
        this(-1, traceId, spanId, field, message);
    }

    /** Index of the trace within the submitted batch, or -1 when validated on its own. */
    public int getTraceIndex() {
        return traceIndex;
    }

    public String getTraceId() {
        return traceId;
    }

    /** Null when the violation is on the trace itself. */
    public String getSpanId() {
        return spanId;
    }

    public String getField() {
        return field;
    }

    private static String describe(int traceIndex, String traceId, String spanId, String field) {
        StringBuilder sb = new StringBuilder("[");
        if (traceIndex >= 0) sb.append("trace#").append(traceIndex).append(' ');
        sb.append("trace_id=").append(traceId);
        if (spanId != null) sb.append(" span_id=").append(spanId);
        sb.append(" field=").append(field).append(']');
        return sb.toString();
    }
}
