package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Directional funding pressure estimate.
 *
 * <p>{@code imbalance} is always the {@link OrderBookStats#imbalance()} the analyzer was
 * given, unmodified. {@code confidence} is the score strength before any reversal
 * override was applied to {@code direction}.
 */
public record PressureResult(
    @JsonProperty("direction") PressureDirection direction,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("imbalance") double imbalance,
    @JsonProperty("bidAskRatio") double bidAskRatio,
    @JsonProperty("metrics") Map<String, Object> metrics
) {
    public static PressureResult unknown(OrderBookStats book) {
        return new PressureResult(PressureDirection.UNKNOWN, 0.0,
            book.imbalance(), book.pressureRatio(), Map.of());
    }
}
