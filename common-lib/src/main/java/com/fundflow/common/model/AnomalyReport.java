package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnomalyReport(
    @JsonProperty("hasAnomalies") boolean hasAnomalies,
    @JsonProperty("mode") AnomalyMode mode,
    @JsonProperty("anomalies") List<AnomalyRecord> anomalies
) {
    public static AnomalyReport of(AnomalyMode mode, List<AnomalyRecord> anomalies) {
        return new AnomalyReport(!anomalies.isEmpty(), mode, List.copyOf(anomalies));
    }

    public static AnomalyReport empty(AnomalyMode mode) {
        return new AnomalyReport(false, mode, List.of());
    }
}
