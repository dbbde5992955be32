package com.fundflow.common.pressure;

import com.fundflow.common.model.Bar;
import com.fundflow.common.model.OrderBookStats;
import com.fundflow.common.model.PressureDirection;
import com.fundflow.common.model.PressureResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Primary {@link PressureAnalyzer}: weighted blend of recent inflow ratio and three
 * order-book imbalance measures, with a reversal override.
 *
 * <h3>Score</h3>
 * <pre>
 *   avgInflowRatio      = mean(netInflow / quoteVolume) over the last 10 bars
 *   volumeImbalance     = book.imbalance
 *   valueImbalance      = bidPressure / (bidPressure + askPressure) - 0.5     0 when empty
 *   nearVolumeImbalance = volumeImbalance
 *   pressureScore       = 0.4·avgInflowRatio + 0.2·volumeImbalance
 *                       + 0.2·valueImbalance + 0.2·nearVolumeImbalance
 * </pre>
 *
 * <p>{@code nearVolumeImbalance} stands in for an imbalance measured only near the touch;
 * it currently equals {@code volumeImbalance}.
 *
 * <h3>Reversal override</h3>
 * Mean {@code priceChangePct} of the last 5 bars below -1% while volumeImbalance &gt; 0.1
 * gives {@link PressureDirection#POTENTIAL_REVERSAL_UP}; above +1% while volumeImbalance
 * &lt; -0.1 gives {@link PressureDirection#POTENTIAL_REVERSAL_DOWN}. Confidence keeps the
 * strength of the base call.
 */
public class FlowBookPressureAnalyzer implements PressureAnalyzer {

    private static final String COMPONENT = "FlowBookPressureAnalyzer";

    private static final double INFLOW_WEIGHT = 0.4;
    private static final double BOOK_WEIGHT   = 0.2;

    private static final int    REVERSAL_WINDOW     = 5;
    private static final double REVERSAL_PRICE_PCT  = 1.0;
    private static final double REVERSAL_IMBALANCE  = 0.1;

    @Override
    public PressureStrategy strategy() {
        return PressureStrategy.FLOW_BOOK;
    }

    @Override
    public PressureResult analyze(List<Bar> bars, OrderBookStats book) {
        PressureScoring.requireBook(book, COMPONENT);
        if (bars == null || bars.isEmpty()) {
            return PressureResult.unknown(book);
        }

        double avgInflowRatio      = PressureScoring.averageInflowRatio(bars, FLOW_WINDOW);
        double volumeImbalance     = book.imbalance();
        double valueImbalance      = valueImbalance(book);
        double nearVolumeImbalance = volumeImbalance;

        double pressureScore = INFLOW_WEIGHT * avgInflowRatio
            + BOOK_WEIGHT * volumeImbalance
            + BOOK_WEIGHT * valueImbalance
            + BOOK_WEIGHT * nearVolumeImbalance;

        PressureScoring.Call call = PressureScoring.classify(pressureScore);

        double recentPriceChange = PressureScoring.recent(bars, REVERSAL_WINDOW).stream()
            .mapToDouble(Bar::priceChangePct)
            .average()
            .orElse(0.0);
        PressureDirection direction = reversal(recentPriceChange, volumeImbalance, call.direction());

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("avgInflowRatio",       avgInflowRatio);
        metrics.put("volumeImbalance",      volumeImbalance);
        metrics.put("valueImbalance",       valueImbalance);
        metrics.put("nearVolumeImbalance",  nearVolumeImbalance);
        metrics.put("pressureScore",        pressureScore);
        metrics.put("recentPriceChangePct", recentPriceChange);
        metrics.put("baseDirection",        call.direction());

        return new PressureResult(direction, call.strength(), book.imbalance(), book.pressureRatio(),
            Collections.unmodifiableMap(metrics));
    }

    static double valueImbalance(OrderBookStats book) {
        double total = book.bidPressure() + book.askPressure();
        return total == 0.0 ? 0.0 : book.bidPressure() / total - 0.5;
    }

    static PressureDirection reversal(double recentPriceChange, double volumeImbalance, PressureDirection base) {
        if (recentPriceChange < -REVERSAL_PRICE_PCT && volumeImbalance > REVERSAL_IMBALANCE) {
            return PressureDirection.POTENTIAL_REVERSAL_UP;
        }
        if (recentPriceChange > REVERSAL_PRICE_PCT && volumeImbalance < -REVERSAL_IMBALANCE) {
            return PressureDirection.POTENTIAL_REVERSAL_DOWN;
        }
        return base;
    }
}
