package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundflow.common.model.PriceLevel;

import java.util.List;

/** One order-book snapshot, bids descending and asks ascending as the exchange sends them. */
public record DepthSnapshot(
    @JsonProperty("bids") List<PriceLevel> bids,
    @JsonProperty("asks") List<PriceLevel> asks
) {}
