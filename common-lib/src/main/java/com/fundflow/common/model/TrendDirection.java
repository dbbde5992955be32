package com.fundflow.common.model;

public enum TrendDirection {
    UP,
    DOWN
}
