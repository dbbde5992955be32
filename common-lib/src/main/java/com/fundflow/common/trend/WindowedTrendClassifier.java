package com.fundflow.common.trend;

import com.fundflow.common.model.Bar;
import com.fundflow.common.model.FundingTrend;
import com.fundflow.common.model.MarketStage;
import com.fundflow.common.model.TrendResult;
import com.fundflow.common.stats.Statistics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Simpler legacy {@link TrendClassifier}: compares net inflow of the older and newer half
 * of the window and the window's overall price move. No regression.
 *
 * <pre>
 *   inflowShift = (Σ newer half - Σ older half) / (|Σ older half| + |Σ newer half|)   ∈ [-1, 1]
 *   priceChange = (lastClose - firstOpen) / firstOpen × 100
 * </pre>
 *
 * <p>Trend: shift &gt; 0.5 INCREASING, &gt; 0.2 SLIGHTLY_INCREASING, mirrored for the
 * decreasing side, otherwise NEUTRAL.
 */
public class WindowedTrendClassifier implements TrendClassifier {

    private static final double PRICE_MOVE_PCT = 1.0;
    private static final double CONFIDENCE_CAP = 0.95;

    private static final double STRONG_SHIFT = 0.5;
    private static final double SLIGHT_SHIFT = 0.2;

    public record Signals(double priceChangePct, double inflowShift) {}

    public static final StageRuleTable<Signals> STAGE_RULES = new StageRuleTable<>(List.of(
        StageRule.of("uptrend",
            s -> s.priceChangePct() > PRICE_MOVE_PCT && s.inflowShift() > 0,
            s -> StageOutcome.of(MarketStage.UPTREND, directional(s),
                "Price up over the window with growing net inflow", describe(s))),
        StageRule.of("weakening-uptrend",
            s -> s.priceChangePct() > PRICE_MOVE_PCT,
            s -> StageOutcome.of(MarketStage.WEAKENING_UPTREND, directional(s),
                "Price up over the window but net inflow fading", describe(s))),
        StageRule.of("downtrend",
            s -> s.priceChangePct() < -PRICE_MOVE_PCT && s.inflowShift() < 0,
            s -> StageOutcome.of(MarketStage.DOWNTREND, directional(s),
                "Price down over the window with shrinking net inflow", describe(s))),
        StageRule.of("weakening-downtrend",
            s -> s.priceChangePct() < -PRICE_MOVE_PCT,
            s -> StageOutcome.of(MarketStage.WEAKENING_DOWNTREND, directional(s),
                "Price down over the window but net inflow recovering", describe(s)))
    ), s -> StageOutcome.of(MarketStage.CONSOLIDATION, 0.5,
        "Price move within ±1% over the window", describe(s)));

    @Override
    public TrendStrategy strategy() {
        return TrendStrategy.WINDOWED;
    }

    @Override
    public TrendResult classify(List<Bar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            return TrendResult.insufficientData();
        }

        double[] inflows = bars.stream().mapToDouble(Bar::netInflow).toArray();
        double netInflowTotal  = Statistics.sum(inflows);
        double netInflowRecent = Statistics.sum(Statistics.tail(inflows, RECENT_WINDOW));

        int half = inflows.length / 2;
        double olderHalf = 0.0;
        double newerHalf = 0.0;
        for (int i = 0; i < inflows.length; i++) {
            if (i < half) olderHalf += inflows[i];
            else          newerHalf += inflows[i];
        }
        double scale       = Math.abs(olderHalf) + Math.abs(newerHalf);
        double inflowShift = scale == 0.0 ? 0.0 : (newerHalf - olderHalf) / scale;

        double firstOpen      = bars.get(0).open();
        double lastClose      = bars.get(bars.size() - 1).close();
        double priceChangePct = (lastClose - firstOpen) / firstOpen * 100.0;

        Signals signals = new Signals(priceChangePct, inflowShift);
        StageOutcome outcome = STAGE_RULES.resolve(signals);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("olderHalfInflow",      olderHalf);
        metrics.put("newerHalfInflow",      newerHalf);
        metrics.put("inflowShift",          inflowShift);
        metrics.put("windowPriceChangePct", priceChangePct);
        metrics.put("stageRule",            STAGE_RULES.matchingRule(signals));

        return new TrendResult(
            fundingTrend(inflowShift),
            outcome.confidence(),
            netInflowTotal,
            netInflowRecent,
            outcome.stage(),
            outcome.reasons(),
            Collections.unmodifiableMap(metrics));
    }

    public static FundingTrend fundingTrend(double inflowShift) {
        if (inflowShift >  STRONG_SHIFT) return FundingTrend.INCREASING;
        if (inflowShift >  SLIGHT_SHIFT) return FundingTrend.SLIGHTLY_INCREASING;
        if (inflowShift < -STRONG_SHIFT) return FundingTrend.DECREASING;
        if (inflowShift < -SLIGHT_SHIFT) return FundingTrend.SLIGHTLY_DECREASING;
        return FundingTrend.NEUTRAL;
    }

    private static double directional(Signals s) {
        return Math.min(Math.abs(s.inflowShift()), CONFIDENCE_CAP);
    }

    private static String describe(Signals s) {
        return String.format(Locale.ROOT, "Window price change: %.2f%%, inflow shift: %.2f",
            s.priceChangePct(), s.inflowShift());
    }
}
