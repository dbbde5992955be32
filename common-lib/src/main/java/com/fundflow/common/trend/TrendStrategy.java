package com.fundflow.common.trend;

public enum TrendStrategy {
    REGRESSION,
    WINDOWED;

    public TrendClassifier create() {
        return switch (this) {
            case REGRESSION -> new RegressionTrendClassifier();
            case WINDOWED   -> new WindowedTrendClassifier();
        };
    }
}
