package com.fundflow.common.pressure;

import com.fundflow.common.model.Bar;
import com.fundflow.common.model.OrderBookStats;
import com.fundflow.common.model.PressureResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simpler legacy {@link PressureAnalyzer}: an even blend of recent inflow ratio and
 * book quantity imbalance, no value weighting and no reversal override.
 *
 * <pre>
 *   pressureScore = 0.5·avgInflowRatio + 0.5·volumeImbalance
 * </pre>
 */
public class BookImbalancePressureAnalyzer implements PressureAnalyzer {

    private static final String COMPONENT = "BookImbalancePressureAnalyzer";

    private static final double FLOW_WEIGHT = 0.5;
    private static final double BOOK_WEIGHT = 0.5;

    @Override
    public PressureStrategy strategy() {
        return PressureStrategy.BOOK_IMBALANCE;
    }

    @Override
    public PressureResult analyze(List<Bar> bars, OrderBookStats book) {
        PressureScoring.requireBook(book, COMPONENT);
        if (bars == null || bars.isEmpty()) {
            return PressureResult.unknown(book);
        }

        double avgInflowRatio  = PressureScoring.averageInflowRatio(bars, FLOW_WINDOW);
        double volumeImbalance = book.imbalance();
        double pressureScore   = FLOW_WEIGHT * avgInflowRatio + BOOK_WEIGHT * volumeImbalance;

        PressureScoring.Call call = PressureScoring.classify(pressureScore);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("avgInflowRatio",  avgInflowRatio);
        metrics.put("volumeImbalance", volumeImbalance);
        metrics.put("pressureScore",   pressureScore);

        return new PressureResult(call.direction(), call.strength(), book.imbalance(), book.pressureRatio(),
            Collections.unmodifiableMap(metrics));
    }
}
