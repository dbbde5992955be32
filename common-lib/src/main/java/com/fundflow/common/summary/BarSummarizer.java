package com.fundflow.common.summary;

import com.fundflow.common.model.Bar;
import com.fundflow.common.model.BarSummary;

import java.util.List;

/**
 * Window summary for reports. {@code currentPrice} is the open of the newest completed
 * bar; {@code priceChangePct} runs from the first bar's open to the last bar's close.
 */
public final class BarSummarizer {

    private BarSummarizer() {}

    public static BarSummary summarize(List<Bar> bars) {
        if (bars == null || bars.isEmpty()) {
            return new BarSummary(null, null, 0.0, 0.0, 0.0, 0.0);
        }
        Bar first = bars.get(0);
        Bar last  = bars.get(bars.size() - 1);
        return new BarSummary(
            first.openTime(),
            last.closeTime(),
            (last.close() - first.open()) / first.open() * 100.0,
            last.open(),
            bars.stream().mapToDouble(Bar::volume).sum(),
            bars.stream().mapToDouble(Bar::quoteVolume).sum());
    }
}
