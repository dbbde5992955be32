package com.fundflow.common.model;

public enum Direction {
    HIGH,
    LOW;

    public static Direction ofSign(double value) {
        return value >= 0 ? HIGH : LOW;
    }
}
