package com.fundflow.common.model;

public enum PressureDirection {
    STRONG_UPWARD,
    UPWARD,
    NEUTRAL,
    DOWNWARD,
    STRONG_DOWNWARD,
    POTENTIAL_REVERSAL_UP,
    POTENTIAL_REVERSAL_DOWN,
    UNKNOWN
}
