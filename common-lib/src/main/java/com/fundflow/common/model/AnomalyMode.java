package com.fundflow.common.model;

/**
 * Selectable anomaly detection variant. The two modes read different inputs and
 * report different severities, so callers choose one explicitly.
 */
public enum AnomalyMode {
    /** Quote volume and relative price change statistics, one record per rule hit. */
    RATIO,
    /** Raw volume and net inflow z-scores, merged per bar, last five records only. */
    ZSCORE
}
