package com.fundflow.common.model;

public enum MarketKind {
    SPOT,
    FUTURES
}
