package com.tracelens.common.aggregation;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/** Summed trace cost for one observed calendar day. */
public record DailyCost(
    @JsonProperty("date") @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd") LocalDate date,
    @JsonProperty("cost") double cost
) {}
