package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundflow.common.model.RawBar;

import java.util.List;

/**
 * Raw data fetched for one market of one symbol. {@code klines} still contains the
 * forming candle as its last row.
 */
public record MarketSnapshot(
    @JsonProperty("klines") List<RawBar> klines,
    @JsonProperty("depth") DepthSnapshot depth
) {}
