package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Full analysis output; {@code analysis} is keyed by symbol in request order. */
public record AnalysisReport(
    @JsonProperty("metadata") AnalysisMetadata metadata,
    @JsonProperty("analysis") Map<String, SymbolAnalysis> analysis
) {}
