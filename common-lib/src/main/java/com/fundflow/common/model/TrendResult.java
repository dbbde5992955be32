package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Output of a {@code TrendClassifier} run.
 *
 * <p>{@code metrics} carries the raw values the classification was derived from; keys
 * depend on the strategy that produced the result.
 */
public record TrendResult(
    @JsonProperty("trend") FundingTrend trend,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("netInflowTotal") double netInflowTotal,
    @JsonProperty("netInflowRecent") double netInflowRecent,
    @JsonProperty("stage") MarketStage stage,
    @JsonProperty("reasons") List<String> reasons,
    @JsonProperty("metrics") Map<String, Object> metrics
) {
    /** Sentinel for windows too short to classify. */
    public static TrendResult insufficientData() {
        return new TrendResult(FundingTrend.UNKNOWN, 0.0, 0.0, 0.0,
            MarketStage.INSUFFICIENT_DATA, List.of(), Map.of());
    }
}
