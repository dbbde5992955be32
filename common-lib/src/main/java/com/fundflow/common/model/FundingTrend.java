package com.fundflow.common.model;

/**
 * Direction of net inflow across the analysis window.
 */
public enum FundingTrend {
    INCREASING,
    SLIGHTLY_INCREASING,
    NEUTRAL,
    SLIGHTLY_DECREASING,
    DECREASING,
    UNKNOWN
}
