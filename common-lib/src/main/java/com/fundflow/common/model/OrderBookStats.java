package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate of one depth snapshot.
 *
 * <p>{@code imbalance} lies in [-1, 1] and is 0 for an empty book.
 * {@code pressureRatio} is {@link Double#POSITIVE_INFINITY} when ask pressure is 0.
 */
public record OrderBookStats(
    @JsonProperty("totalBidQty") double totalBidQty,
    @JsonProperty("totalAskQty") double totalAskQty,
    @JsonProperty("imbalance") double imbalance,
    @JsonProperty("bidPressure") double bidPressure,
    @JsonProperty("askPressure") double askPressure,
    @JsonProperty("pressureRatio") double pressureRatio,
    @JsonProperty("priceRange") PriceRange priceRange
) {
    @JsonIgnore
    public boolean isPressureUnbounded() {
        return Double.isInfinite(pressureRatio);
    }
}
