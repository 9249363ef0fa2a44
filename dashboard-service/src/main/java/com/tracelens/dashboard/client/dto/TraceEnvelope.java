package com.tracelens.dashboard.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.model.Trace;

/** Body of {@code GET /api/v1/traces/{id}}. */
public record TraceEnvelope(
    @JsonProperty("success") boolean success,
    @JsonProperty("data")    Trace data
) {}
