package com.fundflow.common.pressure;

import com.fundflow.common.model.Bar;
import com.fundflow.common.model.OrderBookStats;
import com.fundflow.common.model.PressureResult;

import java.util.List;

/**
 * Strategy contract for combining recent flow with one order-book snapshot into a
 * directional pressure call.
 *
 * <p>Every implementation passes {@link OrderBookStats#imbalance()} through to
 * {@link PressureResult#imbalance()} untouched. An empty bar window yields
 * {@link PressureResult#unknown(OrderBookStats)}.
 */
public interface PressureAnalyzer {

    /** Bars (most recent) whose inflow ratio is averaged. */
    int FLOW_WINDOW = 10;

    PressureResult analyze(List<Bar> bars, OrderBookStats book);

    PressureStrategy strategy();
}
