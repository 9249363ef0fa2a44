package com.tracelens.common.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Human-readable observation about a window.
 *
 * <p>{@code type}: warning | info | success.
 * {@code severity}: high | medium | low | info.
 */
public record Insight(
    @JsonProperty("type")        String type,
    @JsonProperty("category")    String category,
    @JsonProperty("title")       String title,
    @JsonProperty("description") String description,
    @JsonProperty("severity")    String severity
) {}
