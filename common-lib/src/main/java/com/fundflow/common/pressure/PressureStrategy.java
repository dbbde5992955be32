package com.fundflow.common.pressure;

public enum PressureStrategy {
    FLOW_BOOK,
    BOOK_IMBALANCE;

    public PressureAnalyzer create() {
        return switch (this) {
            case FLOW_BOOK      -> new FlowBookPressureAnalyzer();
            case BOOK_IMBALANCE -> new BookImbalancePressureAnalyzer();
        };
    }
}
