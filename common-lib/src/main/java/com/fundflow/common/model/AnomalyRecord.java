package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One anomaly observation for a bar. Components that did not fire are {@code null};
 * {@code flowRatio} is set only for the extreme inflow/outflow rules.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyRecord(
    @JsonProperty("time") Instant time,
    @JsonProperty("types") List<AnomalyType> types,
    @JsonProperty("volume") Deviation volume,
    @JsonProperty("netInflow") Deviation netInflow,
    @JsonProperty("priceVolumeMismatch") PriceVolumeMismatch priceVolumeMismatch,
    @JsonProperty("flowRatio") Double flowRatio
) {
    public boolean hasType(AnomalyType type) {
        return types.contains(type);
    }
}
