package com.fundflow.common.pressure;

import com.fundflow.common.exception.InvalidInputException;
import com.fundflow.common.model.Bar;
import com.fundflow.common.model.OrderBookStats;
import com.fundflow.common.model.PressureDirection;

import java.util.List;

/**
 * Score-to-direction mapping shared by the pressure strategies.
 *
 * <pre>
 *   score &gt;  0.1 → UPWARD,   STRONG_UPWARD   when min(score × 5, 1) &gt; 0.7
 *   score &lt; -0.1 → DOWNWARD, STRONG_DOWNWARD when min(|score| × 5, 1) &gt; 0.7
 *   otherwise    → NEUTRAL,  strength |score| × 5
 * </pre>
 */
final class PressureScoring {

    static final double DIRECTION_THRESHOLD = 0.1;
    static final double STRENGTH_SCALE      = 5.0;
    static final double STRONG_STRENGTH     = 0.7;

    record Call(PressureDirection direction, double strength) {}

    private PressureScoring() {}

    static Call classify(double score) {
        if (score > DIRECTION_THRESHOLD) {
            double strength = Math.min(score * STRENGTH_SCALE, 1.0);
            return new Call(strength > STRONG_STRENGTH ? PressureDirection.STRONG_UPWARD : PressureDirection.UPWARD,
                strength);
        }
        if (score < -DIRECTION_THRESHOLD) {
            double strength = Math.min(Math.abs(score) * STRENGTH_SCALE, 1.0);
            return new Call(strength > STRONG_STRENGTH ? PressureDirection.STRONG_DOWNWARD : PressureDirection.DOWNWARD,
                strength);
        }
        return new Call(PressureDirection.NEUTRAL, Math.abs(score) * STRENGTH_SCALE);
    }

    /** Mean of netInflow / quoteVolume over the last {@code window} bars. */
    static double averageInflowRatio(List<Bar> bars, int window) {
        List<Bar> recent = recent(bars, window);
        return recent.stream().mapToDouble(Bar::inflowRatio).average().orElse(0.0);
    }

    static List<Bar> recent(List<Bar> bars, int window) {
        return bars.subList(Math.max(0, bars.size() - window), bars.size());
    }

    static void requireBook(OrderBookStats book, String component) {
        if (book == null) {
            throw new InvalidInputException(component, "Order book stats are required");
        }
    }
}
