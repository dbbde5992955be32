package com.fundflow.common.orderbook;

import com.fundflow.common.exception.InvalidInputException;
import com.fundflow.common.model.OrderBookStats;
import com.fundflow.common.model.PriceLevel;
import com.fundflow.common.model.PriceRange;

import java.util.List;

/**
 * Reduces one depth snapshot to {@link OrderBookStats}.
 *
 * <pre>
 *   imbalance     = (bidQty - askQty) / (bidQty + askQty)      0 when both are 0
 *   bidPressure   = Σ price × qty over bids   (askPressure likewise)
 *   pressureRatio = bidPressure / askPressure                  +∞ when askPressure is 0
 *   spread        = bestAsk - bestBid,  spreadPct = spread / bestBid × 100
 * </pre>
 *
 * <p>Both sides must be non-empty, otherwise best bid/ask are undefined and an
 * {@link InvalidInputException} is thrown.
 */
public final class DepthAggregator {

    private static final String COMPONENT = "DepthAggregator";

    private DepthAggregator() {}

    public static OrderBookStats aggregate(List<PriceLevel> bids, List<PriceLevel> asks) {
        requireSide(bids, "bid");
        requireSide(asks, "ask");

        double bidQty = 0.0, askQty = 0.0;
        double bidPressure = 0.0, askPressure = 0.0;
        double bestBid = Double.NEGATIVE_INFINITY;
        double bestAsk = Double.POSITIVE_INFINITY;

        for (PriceLevel level : bids) {
            validate(level, "bid");
            bidQty      += level.quantity();
            bidPressure += level.price() * level.quantity();
            bestBid      = Math.max(bestBid, level.price());
        }
        for (PriceLevel level : asks) {
            validate(level, "ask");
            askQty      += level.quantity();
            askPressure += level.price() * level.quantity();
            bestAsk      = Math.min(bestAsk, level.price());
        }

        double totalQty      = bidQty + askQty;
        double imbalance     = totalQty == 0.0 ? 0.0 : (bidQty - askQty) / totalQty;
        double pressureRatio = askPressure > 0.0 ? bidPressure / askPressure : Double.POSITIVE_INFINITY;
        double spread        = bestAsk - bestBid;
        double spreadPct     = spread / bestBid * 100.0;

        return new OrderBookStats(bidQty, askQty, imbalance, bidPressure, askPressure, pressureRatio,
            new PriceRange(bestBid, bestAsk, spread, spreadPct));
    }

    /**
     * Same as {@link #aggregate(List, List)} but only the first {@code depthLimit} levels
     * of each side are considered. Sides are expected in exchange order (bids descending,
     * asks ascending), so the cut keeps the levels nearest the touch.
     */
    public static OrderBookStats aggregate(List<PriceLevel> bids, List<PriceLevel> asks, int depthLimit) {
        if (depthLimit < 1) {
            throw new InvalidInputException(COMPONENT, "depthLimit must be positive, got " + depthLimit);
        }
        requireSide(bids, "bid");
        requireSide(asks, "ask");
        return aggregate(
            bids.subList(0, Math.min(depthLimit, bids.size())),
            asks.subList(0, Math.min(depthLimit, asks.size())));
    }

    private static void requireSide(List<PriceLevel> levels, String side) {
        if (levels == null || levels.isEmpty()) {
            throw new InvalidInputException(COMPONENT, "Empty " + side + " side; best " + side + " undefined");
        }
    }

    private static void validate(PriceLevel level, String side) {
        if (level == null
                || !Double.isFinite(level.price()) || !Double.isFinite(level.quantity())
                || level.price() <= 0 || level.quantity() < 0) {
            throw new InvalidInputException(COMPONENT, "Malformed " + side + " level: " + level);
        }
    }
}
