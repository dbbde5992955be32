package com.fundflow.common.summary;

import com.fundflow.common.TestBars;
import com.fundflow.common.model.Bar;
import com.fundflow.common.model.BarSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BarSummarizerTest {

    @Test
    @DisplayName("window from first open to last close")
    void summarizesWindow() {
        List<Bar> bars = List.of(
            TestBars.bar(0, 100, 102, 10, 1_010, 0),
            TestBars.bar(1, 102, 105, 20, 2_070, 0),
            TestBars.bar(2, 105, 110, 30, 3_225, 0));

        BarSummary summary = BarSummarizer.summarize(bars);

        assertEquals(TestBars.openTime(0), summary.firstTime());
        assertEquals(bars.get(2).closeTime(), summary.lastTime());
        assertEquals(10.0, summary.priceChangePct(), 1e-9);
        assertEquals(105.0, summary.currentPrice());
        assertEquals(60.0, summary.totalVolume(), 1e-12);
        assertEquals(6_305.0, summary.totalQuoteVolume(), 1e-9);
    }

    @Test
    @DisplayName("empty window → null times and zeros")
    void emptyWindow() {
        BarSummary summary = BarSummarizer.summarize(List.of());

        assertNull(summary.firstTime());
        assertNull(summary.lastTime());
        assertEquals(0.0, summary.totalVolume());
    }
}
