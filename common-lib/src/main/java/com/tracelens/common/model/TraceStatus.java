package com.tracelens.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a trace or span. Serialized in lowercase ({@code "success"}, {@code "error"}, ...).
 *
 * <p>Declaration order is the canonical display order used wherever statuses are listed
 * and counts tie.
 */
public enum TraceStatus {
    SUCCESS,
    ERROR,
    TIMEOUT,
    PARTIAL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Anything other than {@link #SUCCESS} counts as a failure in error-rate math. */
    public boolean isFailure() {
        return this != SUCCESS;
    }

    /**
     * Case-insensitive parse of the wire value.
     *
     * @throws IllegalArgumentException for null, blank or unknown values
     */
    @JsonCreator
    public static TraceStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TraceStatus status : values()) {
            if (status.name().equals(normalized)) return status;
        }
        throw new IllegalArgumentException("unknown status: " + value);
    }
}
