package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Window-level summary of a normalized bar sequence. Times are {@code null} for an
 * empty window.
 */
public record BarSummary(
    @JsonProperty("firstTime") Instant firstTime,
    @JsonProperty("lastTime") Instant lastTime,
    @JsonProperty("priceChangePct") double priceChangePct,
    @JsonProperty("currentPrice") double currentPrice,
    @JsonProperty("totalVolume") double totalVolume,
    @JsonProperty("totalQuoteVolume") double totalQuoteVolume
) {}
