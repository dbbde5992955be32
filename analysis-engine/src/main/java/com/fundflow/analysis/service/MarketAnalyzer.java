package com.fundflow.analysis.service;

import com.fundflow.analysis.model.DepthSnapshot;
import com.fundflow.analysis.model.MarketAnalysis;
import com.fundflow.analysis.model.MarketSnapshot;
import com.fundflow.common.anomaly.AnomalyDetector;
import com.fundflow.common.exception.InvalidInputException;
import com.fundflow.common.model.AnomalyMode;
import com.fundflow.common.model.AnomalyReport;
import com.fundflow.common.model.Bar;
import com.fundflow.common.model.MarketKind;
import com.fundflow.common.model.OrderBookStats;
import com.fundflow.common.model.PressureResult;
import com.fundflow.common.model.TrendResult;
import com.fundflow.common.normalize.BarNormalizer;
import com.fundflow.common.orderbook.DepthAggregator;
import com.fundflow.common.pressure.PressureAnalyzer;
import com.fundflow.common.pressure.PressureStrategy;
import com.fundflow.common.summary.BarSummarizer;
import com.fundflow.common.trend.TrendClassifier;
import com.fundflow.common.trend.TrendStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the pure core over one market snapshot: normalize, aggregate the book, then
 * trend, anomaly and pressure over the same bars. Synchronous; callers schedule it.
 */
@Component
public class MarketAnalyzer {

    private static final String COMPONENT = "MarketAnalyzer";

    private final TrendClassifier  trendClassifier;
    private final AnomalyDetector  anomalyDetector;
    private final PressureAnalyzer pressureAnalyzer;
    private final int              depthLimit;

    public MarketAnalyzer(TrendClassifier trendClassifier,
                          AnomalyDetector anomalyDetector,
                          PressureAnalyzer pressureAnalyzer,
                          @Value("${analysis.depth-limit:1000}") int depthLimit) {
        this.trendClassifier  = trendClassifier;
        this.anomalyDetector  = anomalyDetector;
        this.pressureAnalyzer = pressureAnalyzer;
        this.depthLimit       = depthLimit;
    }

    public MarketRun analyze(String symbol, MarketKind kind, MarketSnapshot snapshot) {
        if (snapshot == null) {
            throw new InvalidInputException(COMPONENT, "Missing " + kind + " snapshot for symbol=" + symbol);
        }
        DepthSnapshot depth = snapshot.depth();
        if (depth == null) {
            throw new InvalidInputException(COMPONENT, "Missing " + kind + " depth for symbol=" + symbol);
        }

        List<Bar> bars       = BarNormalizer.normalize(snapshot.klines());
        OrderBookStats book  = DepthAggregator.aggregate(depth.bids(), depth.asks(), depthLimit);

        TrendResult trend        = trendClassifier.classify(bars);
        AnomalyReport anomalies  = anomalyDetector.detect(bars);
        PressureResult pressure  = pressureAnalyzer.analyze(bars, book);

        return new MarketRun(symbol, kind, bars,
            new MarketAnalysis(BarSummarizer.summarize(bars), trend, anomalies, book, pressure));
    }

    public TrendStrategy trendStrategy() {
        return trendClassifier.strategy();
    }

    public AnomalyMode anomalyMode() {
        return anomalyDetector.mode();
    }

    public PressureStrategy pressureStrategy() {
        return pressureAnalyzer.strategy();
    }

    public int depthLimit() {
        return depthLimit;
    }
}
