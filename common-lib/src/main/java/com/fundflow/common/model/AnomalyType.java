package com.fundflow.common.model;

public enum AnomalyType {
    // ratio mode
    HIGH_VOLUME_LOW_PRICE_CHANGE,
    HIGH_PRICE_CHANGE_LOW_VOLUME,
    EXTREME_NET_INFLOW,
    EXTREME_NET_OUTFLOW,
    // z-score mode
    VOLUME_OUTLIER,
    NET_INFLOW_OUTLIER,
    PRICE_VOLUME_MISMATCH
}
