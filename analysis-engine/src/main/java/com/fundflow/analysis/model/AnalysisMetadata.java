package com.fundflow.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundflow.common.model.Interval;

import java.time.Instant;
import java.util.List;

/**
 * Run-level context of a report. {@code symbolsAnalyzed} keeps request order;
 * {@code klinesCount} is the window size: completed bars
 * per market once the forming candle is dropped.
 */
public record AnalysisMetadata(
    @JsonProperty("analysisTime") Instant analysisTime,
    @JsonProperty("symbolsAnalyzed") List<String> symbolsAnalyzed,
    @JsonProperty("interval") Interval interval,
    @JsonProperty("dataSourceName") String dataSourceName,
    @JsonProperty("klinesCount") int klinesCount
) {}
