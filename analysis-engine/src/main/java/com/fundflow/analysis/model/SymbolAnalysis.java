package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundflow.common.model.ComparisonResult;

public record SymbolAnalysis(
    @JsonProperty("spot") MarketAnalysis spot,
    @JsonProperty("futures") MarketAnalysis futures,
    @JsonProperty("comparison") ComparisonResult comparison
) {}
