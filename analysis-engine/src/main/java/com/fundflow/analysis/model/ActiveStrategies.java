package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundflow.common.model.AnomalyMode;
import com.fundflow.common.pressure.PressureStrategy;
import com.fundflow.common.trend.TrendStrategy;

public record ActiveStrategies(
    @JsonProperty("trend") TrendStrategy trend,
    @JsonProperty("anomaly") AnomalyMode anomaly,
    @JsonProperty("pressure") PressureStrategy pressure,
    @JsonProperty("windowSize") int windowSize,
    @JsonProperty("depthLimit") int depthLimit
) {}
