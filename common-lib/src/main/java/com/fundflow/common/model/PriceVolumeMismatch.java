package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriceVolumeMismatch(
    @JsonProperty("priceChangePct") double priceChangePct,
    @JsonProperty("volumeZScore") double volumeZScore
) {}
