package com.tracelens.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.model.Trace;

import java.util.List;

/** The two windows a caller already retrieved; either may be omitted for an empty window. */
public record DashboardRequest(
    @JsonProperty("current")  List<Trace> current,
    @JsonProperty("previous") List<Trace> previous
) {}
