package com.fundflow.analysis.service;

import com.fundflow.analysis.model.MarketAnalysis;
import com.fundflow.common.model.Bar;
import com.fundflow.common.model.MarketKind;

import java.util.List;

/** Result for one (symbol, market) pair, with the normalized bars kept for comparison. */
public record MarketRun(String symbol, MarketKind kind, List<Bar> bars, MarketAnalysis analysis) {}
