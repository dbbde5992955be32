package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Spot versus futures differences for one symbol.
 */
public record ComparisonResult(
    @JsonProperty("priceDiffPct") double priceDiffPct,
    @JsonProperty("volumeRatio") double volumeRatio,
    @JsonProperty("netInflowDiff") double netInflowDiff
) {}
