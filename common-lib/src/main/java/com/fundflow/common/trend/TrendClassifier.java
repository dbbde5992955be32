package com.fundflow.common.trend;

import com.fundflow.common.model.Bar;
import com.fundflow.common.model.TrendResult;

import java.util.List;

/**
 * Strategy contract for classifying funding-flow trend and market stage over a window
 * of normalized bars.
 *
 * <p>Implementations must be stateless and pure: the same bars always produce the same
 * {@link TrendResult}, and windows below the strategy's minimum size return
 * {@link TrendResult#insufficientData()} rather than throwing.
 *
 * <p>Implementations: {@link RegressionTrendClassifier} (primary) and
 * {@link WindowedTrendClassifier} (simpler legacy heuristic). They disagree numerically,
 * so the active one is chosen by configuration.
 */
public interface TrendClassifier {

    /** Bars required before a classification is attempted. */
    int MIN_BARS = 10;

    /** Size of the "recent" sub-window used for {@code netInflowRecent}. */
    int RECENT_WINDOW = 10;

    TrendResult classify(List<Bar> bars);

    TrendStrategy strategy();
}
