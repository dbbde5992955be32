package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriceRange(
    @JsonProperty("bestBid") double bestBid,
    @JsonProperty("bestAsk") double bestAsk,
    @JsonProperty("spread") double spread,
    @JsonProperty("spreadPct") double spreadPct
) {}
