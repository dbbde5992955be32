package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundflow.common.model.MarketKind;

public record SymbolSnapshot(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("spot") MarketSnapshot spot,
    @JsonProperty("futures") MarketSnapshot futures
) {
    public MarketSnapshot market(MarketKind kind) {
        return kind == MarketKind.SPOT ? spot : futures;
    }
}
