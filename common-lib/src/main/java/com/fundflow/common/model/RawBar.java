package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One kline row as delivered by the exchange, before enrichment.
 * Timestamps are epoch milliseconds.
 */
public record RawBar(
    @JsonProperty("openTime") long openTime,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") double volume,
    @JsonProperty("closeTime") long closeTime,
    @JsonProperty("quoteVolume") double quoteVolume
) {
    public static RawBar of(long openTime, double open, double high, double low, double close,
                            double volume, long closeTime, double quoteVolume) {
        return new RawBar(openTime, open, high, low, close, volume, closeTime, quoteVolume);
    }
}
