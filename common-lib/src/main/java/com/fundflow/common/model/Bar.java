package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A completed candle enriched with the heuristic buy/sell split.
 *
 * <p>{@code buyVolume + sellVolume == volume} holds exactly. {@code netInflow} is in
 * quote-currency units; {@code priceChangePct} is the open-to-close move in percent.
 */
public record Bar(
    @JsonProperty("openTime") Instant openTime,
    @JsonProperty("closeTime") Instant closeTime,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") double volume,
    @JsonProperty("quoteVolume") double quoteVolume,
    @JsonProperty("buyVolume") double buyVolume,
    @JsonProperty("sellVolume") double sellVolume,
    @JsonProperty("netInflow") double netInflow,
    @JsonProperty("priceChangePct") double priceChangePct
) {
    /** Open-to-close move as a fraction of the open, sign dropped. */
    public double absoluteChangeFraction() {
        return Math.abs(close - open) / open;
    }

    /** Net inflow as a share of quote volume; 0 when the bar traded nothing. */
    public double inflowRatio() {
        return quoteVolume > 0 ? netInflow / quoteVolume : 0.0;
    }
}
