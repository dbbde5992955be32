package com.fundflow.common.trend;

import com.fundflow.common.TestBars;
import com.fundflow.common.model.Bar;
import com.fundflow.common.model.FundingTrend;
import com.fundflow.common.model.MarketStage;
import com.fundflow.common.model.TrendResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WindowedTrendClassifierTest {

    private final WindowedTrendClassifier classifier = new WindowedTrendClassifier();

    /** 12 bars from {@code firstPrice} to {@code lastPrice}; older half inflow 100 each, newer half {@code newerInflow} each. */
    private static List<Bar> window(double firstPrice, double lastPrice, double newerInflow) {
        List<Bar> bars = new ArrayList<>();
        double step = (lastPrice - firstPrice) / 12;
        for (int i = 0; i < 12; i++) {
            double open  = firstPrice + i * step;
            double close = open + step;
            bars.add(TestBars.bar(i, open, close, 10, 10 * close, i < 6 ? 100 : newerInflow));
        }
        return bars;
    }

    @Test
    @DisplayName("fewer than 10 bars → INSUFFICIENT_DATA")
    void insufficientData() {
        TrendResult result = classifier.classify(window(100, 110, 500).subList(0, 9));
        assertEquals(FundingTrend.UNKNOWN, result.trend());
        assertEquals(MarketStage.INSUFFICIENT_DATA, result.stage());
    }

    @Test
    @DisplayName("price up with growing inflow → UPTREND, INCREASING")
    void uptrend() {
        TrendResult result = classifier.classify(window(100, 110, 500));

        // shift = (3000 - 600) / 3600
        assertEquals(MarketStage.UPTREND, result.stage());
        assertEquals(FundingTrend.INCREASING, result.trend());
        assertEquals(2.0 / 3.0, result.confidence(), 1e-12);
        assertEquals(3600.0, result.netInflowTotal(), 1e-9);
        assertEquals(400.0 + 3000.0, result.netInflowRecent(), 1e-9);
    }

    @Test
    @DisplayName("price up with fading inflow → WEAKENING_UPTREND")
    void weakeningUptrend() {
        TrendResult result = classifier.classify(window(100, 110, 50));
        assertEquals(MarketStage.WEAKENING_UPTREND, result.stage());
        assertEquals(FundingTrend.SLIGHTLY_DECREASING, result.trend());
    }

    @Test
    @DisplayName("price down with shrinking inflow → DOWNTREND")
    void downtrend() {
        TrendResult result = classifier.classify(window(110, 100, -500));
        assertEquals(MarketStage.DOWNTREND, result.stage());
        assertEquals(FundingTrend.DECREASING, result.trend());
        assertEquals("downtrend", result.metrics().get("stageRule"));
    }

    @Test
    @DisplayName("price down with recovering inflow → WEAKENING_DOWNTREND")
    void weakeningDowntrend() {
        TrendResult result = classifier.classify(window(110, 100, 500));
        assertEquals(MarketStage.WEAKENING_DOWNTREND, result.stage());
    }

    @Test
    @DisplayName("flat prices → CONSOLIDATION at 0.5")
    void consolidation() {
        TrendResult result = classifier.classify(window(100, 100.5, 100));

        assertEquals(MarketStage.CONSOLIDATION, result.stage());
        assertEquals(0.5, result.confidence());
        assertEquals(FundingTrend.NEUTRAL, result.trend());
        assertEquals("fallback", result.metrics().get("stageRule"));
    }

    @Test
    @DisplayName("zero inflow everywhere → shift 0")
    void zeroInflow() {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < 10; i++) bars.add(TestBars.bar(i, 100, 100, 1, 100, 0));

        TrendResult result = classifier.classify(bars);
        assertEquals(0.0, (double) result.metrics().get("inflowShift"));
        assertEquals(FundingTrend.NEUTRAL, result.trend());
    }

    @Test
    @DisplayName("fundingTrend() shift thresholds")
    void fundingTrendThresholds() {
        assertEquals(FundingTrend.INCREASING, WindowedTrendClassifier.fundingTrend(0.6));
        assertEquals(FundingTrend.SLIGHTLY_INCREASING, WindowedTrendClassifier.fundingTrend(0.3));
        assertEquals(FundingTrend.NEUTRAL, WindowedTrendClassifier.fundingTrend(0.2));
        assertEquals(FundingTrend.SLIGHTLY_DECREASING, WindowedTrendClassifier.fundingTrend(-0.3));
        assertEquals(FundingTrend.DECREASING, WindowedTrendClassifier.fundingTrend(-0.6));
    }

    @Test
    @DisplayName("strategy enum builds this classifier")
    void strategy() {
        assertInstanceOf(WindowedTrendClassifier.class, TrendStrategy.WINDOWED.create());
        assertEquals(TrendStrategy.WINDOWED, classifier.strategy());
    }
}
