package com.fundflow.common.model;

/**
 * Market phase label attached to a {@link TrendResult}.
 */
public enum MarketStage {
    TOP,
    BOTTOM,
    UPTREND,
    DOWNTREND,
    CONSOLIDATION,
    WEAKENING_UPTREND,
    WEAKENING_DOWNTREND,
    INSUFFICIENT_DATA
}
