package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundflow.common.model.AnomalyReport;
import com.fundflow.common.model.BarSummary;
import com.fundflow.common.model.OrderBookStats;
import com.fundflow.common.model.PressureResult;
import com.fundflow.common.model.TrendResult;

public record MarketAnalysis(
    @JsonProperty("klinesSummary") BarSummary klinesSummary,
    @JsonProperty("fundingTrend") TrendResult fundingTrend,
    @JsonProperty("anomalies") AnomalyReport anomalies,
    @JsonProperty("orderBook") OrderBookStats orderBook,
    @JsonProperty("fundingPressure") PressureResult fundingPressure
) {}
