package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundflow.common.model.Interval;

import java.util.List;

/**
 * Body of {@code POST /api/v1/analyze}. {@code interval} and {@code windowSize} fall back
 * to the configured defaults when absent.
 */
public record AnalysisRequest(
    @JsonProperty("interval") Interval interval,
    @JsonProperty("windowSize") Integer windowSize,
    @JsonProperty("symbols") List<SymbolSnapshot> symbols
) {}
