package com.fundflow.common.comparison;

import com.fundflow.common.model.Bar;
import com.fundflow.common.model.ComparisonResult;
import com.fundflow.common.model.TrendResult;

import java.util.List;

/**
 * Spot versus futures arithmetic for one symbol, over results already produced for
 * each market.
 *
 * <pre>
 *   priceDiffPct  = (spotLastClose - futuresLastClose) / spotLastClose × 100   0 if a side is empty
 *   volumeRatio   = Σ spot volume / Σ futures volume                          denominator 1 when 0
 *   netInflowDiff = spot.netInflowTotal - futures.netInflowTotal
 * </pre>
 */
public final class MarketComparator {

    private MarketComparator() {}

    public static ComparisonResult compare(List<Bar> spotBars, TrendResult spotTrend,
                                           List<Bar> futuresBars, TrendResult futuresTrend) {
        double priceDiffPct = 0.0;
        if (!spotBars.isEmpty() && !futuresBars.isEmpty()) {
            double spotClose    = spotBars.get(spotBars.size() - 1).close();
            double futuresClose = futuresBars.get(futuresBars.size() - 1).close();
            priceDiffPct = (spotClose - futuresClose) / spotClose * 100.0;
        }

        double spotVolume    = spotBars.stream().mapToDouble(Bar::volume).sum();
        double futuresVolume = futuresBars.stream().mapToDouble(Bar::volume).sum();
        double volumeRatio   = spotVolume / (futuresVolume == 0.0 ? 1.0 : futuresVolume);

        double netInflowDiff = spotTrend.netInflowTotal() - futuresTrend.netInflowTotal();

        return new ComparisonResult(priceDiffPct, volumeRatio, netInflowDiff);
    }
}
