package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An observed value with its distance from the window mean.
 */
public record Deviation(
    @JsonProperty("value") double value,
    @JsonProperty("zScore") double zScore,
    @JsonProperty("direction") Direction direction
) {}
