package com.tracelens.dashboard.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelens.common.model.Trace;

import java.util.List;

/** One page of {@code GET /api/v1/traces}. */
public record TracePage(
    @JsonProperty("data")        List<Trace> data,
    @JsonProperty("total_count") long totalCount,
    @JsonProperty("page")        int page,
    @JsonProperty("page_size")   int pageSize,
    @JsonProperty("total_pages") int totalPages
) {
    public List<Trace> traces() {
        return data != null ? data : List.of();
    }
}
