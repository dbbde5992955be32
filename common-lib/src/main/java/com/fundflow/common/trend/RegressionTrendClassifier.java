package com.fundflow.common.trend;

import com.fundflow.common.model.Bar;
import com.fundflow.common.model.FundingTrend;
import com.fundflow.common.model.MarketStage;
import com.fundflow.common.model.TrendDirection;
import com.fundflow.common.model.TrendResult;
import com.fundflow.common.stats.RegressionLine;
import com.fundflow.common.stats.Statistics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Primary {@link TrendClassifier}: regression and correlation over close prices and net
 * inflow, followed by a rule-table stage classification.
 *
 * <h3>Metrics</h3>
 * <ol>
 *   <li><strong>priceTrend</strong>: fraction of bar-to-bar steps where close rose.</li>
 *   <li><strong>inflowTrend</strong>: same fraction over net inflow.</li>
 *   <li><strong>correlation</strong>: Pearson of close vs net inflow.</li>
 *   <li><strong>priceVolatility</strong>: population std-dev of close deltas / mean close.</li>
 *   <li><strong>price / inflow regression</strong>: OLS against bar index; strength = |r|.</li>
 *   <li><strong>recentInflowTrend</strong>: rising fraction over the last 10 inflows.</li>
 * </ol>
 *
 * <h3>Stage rules (first match wins)</h3>
 * <pre>
 * TOP:           priceTrend &gt; 0.7, inflowTrend &lt; 0.3, correlation &lt; -0.3
 * BOTTOM:        priceTrend &lt; 0.3, inflowTrend &gt; 0.7, correlation &lt; -0.3
 * UPTREND:       priceTrend &gt; 0.6, inflowTrend &gt; 0.6, correlation &gt; 0.3
 * DOWNTREND:     priceTrend &lt; 0.4, inflowTrend &lt; 0.4, correlation &gt; 0.3
 * CONSOLIDATION: |priceTrend - 0.5| &lt; 0.15, priceVolatility &lt; 0.01
 * fallback:      UPTREND / WEAKENING_UPTREND / DOWNTREND / WEAKENING_DOWNTREND
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
public class RegressionTrendClassifier implements TrendClassifier {

    private static final double CONFIDENCE_CAP = 0.95;

    private static final double STRONG_TREND   = 0.5;
    private static final double SLIGHT_TREND   = 0.3;

    /** Inputs the stage rules read. */
    public record Signals(double priceTrend, double inflowTrend, double correlation,
                          double priceVolatility, double priceTrendStrength,
                          double inflowTrendStrength) {}

    public static final StageRuleTable<Signals> STAGE_RULES = new StageRuleTable<>(List.of(
        StageRule.of("top",
            s -> s.priceTrend() > 0.7 && s.inflowTrend() < 0.3 && s.correlation() < -0.3,
            s -> new StageOutcome(MarketStage.TOP,
                Math.min(0.7 + s.priceTrend() - s.inflowTrend() - s.correlation(), CONFIDENCE_CAP),
                List.of("Price keeps rising while net inflow shrinks",
                        "Price and net inflow are negatively correlated",
                        strengths(s)))),
        StageRule.of("bottom",
            s -> s.priceTrend() < 0.3 && s.inflowTrend() > 0.7 && s.correlation() < -0.3,
            s -> new StageOutcome(MarketStage.BOTTOM,
                Math.min(0.7 - s.priceTrend() + s.inflowTrend() - s.correlation(), CONFIDENCE_CAP),
                List.of("Price keeps falling while net inflow grows",
                        "Price and net inflow are negatively correlated",
                        strengths(s)))),
        StageRule.of("uptrend",
            s -> s.priceTrend() > 0.6 && s.inflowTrend() > 0.6 && s.correlation() > 0.3,
            s -> new StageOutcome(MarketStage.UPTREND,
                Math.min(s.priceTrend() + s.inflowTrend() + s.correlation() - 1.0, CONFIDENCE_CAP),
                List.of("Price and net inflow rise together",
                        "Price and net inflow are positively correlated",
                        strengths(s)))),
        StageRule.of("downtrend",
            s -> s.priceTrend() < 0.4 && s.inflowTrend() < 0.4 && s.correlation() > 0.3,
            s -> new StageOutcome(MarketStage.DOWNTREND,
                Math.min(1.0 - s.priceTrend() - s.inflowTrend() + s.correlation(), CONFIDENCE_CAP),
                List.of("Price and net inflow fall together",
                        "Price and net inflow are positively correlated",
                        strengths(s)))),
        StageRule.of("consolidation",
            s -> Math.abs(s.priceTrend() - 0.5) < 0.15 && s.priceVolatility() < 0.01,
            s -> new StageOutcome(MarketStage.CONSOLIDATION,
                0.5 + (0.15 - Math.abs(s.priceTrend() - 0.5)) * 3,
                List.of("Low price volatility",
                        "No clear direction",
                        String.format(Locale.ROOT, "Price volatility: %.4f", s.priceVolatility()))))
    ), RegressionTrendClassifier::fallbackStage);

    @Override
    public TrendStrategy strategy() {
        return TrendStrategy.REGRESSION;
    }

    @Override
    public TrendResult classify(List<Bar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            return TrendResult.insufficientData();
        }

        double[] prices   = bars.stream().mapToDouble(Bar::close).toArray();
        double[] inflows  = bars.stream().mapToDouble(Bar::netInflow).toArray();
        double[] volumes  = bars.stream().mapToDouble(Bar::quoteVolume).toArray();

        double netInflowTotal  = Statistics.sum(inflows);
        double netInflowRecent = Statistics.sum(Statistics.tail(inflows, RECENT_WINDOW));

        double priceTrend  = Statistics.risingFraction(prices);
        double inflowTrend = Statistics.risingFraction(inflows);
        double volumeTrend = Statistics.risingFraction(volumes);

        double correlation             = Statistics.pearson(prices, inflows);
        double inflowVolumeCorrelation = Statistics.pearson(inflows, volumes);
        double priceVolatility         = volatility(prices);

        RegressionLine priceLine  = Statistics.linearRegression(prices);
        RegressionLine inflowLine = Statistics.linearRegression(inflows);
        TrendDirection priceDirection  = priceLine.isRising()  ? TrendDirection.UP : TrendDirection.DOWN;
        TrendDirection inflowDirection = inflowLine.isRising() ? TrendDirection.UP : TrendDirection.DOWN;

        double recentInflowTrend = Statistics.risingFraction(Statistics.tail(inflows, RECENT_WINDOW));

        Signals signals = new Signals(priceTrend, inflowTrend, correlation, priceVolatility,
            priceLine.strength(), inflowLine.strength());
        StageOutcome outcome = STAGE_RULES.resolve(signals);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("priceTrend",              priceTrend);
        metrics.put("priceTrendDirection",     priceDirection);
        metrics.put("priceTrendStrength",      priceLine.strength());
        metrics.put("priceSlope",              priceLine.slope());
        metrics.put("priceIntercept",          priceLine.intercept());
        metrics.put("inflowTrend",             inflowTrend);
        metrics.put("inflowTrendDirection",    inflowDirection);
        metrics.put("inflowTrendStrength",     inflowLine.strength());
        metrics.put("inflowSlope",             inflowLine.slope());
        metrics.put("inflowIntercept",         inflowLine.intercept());
        metrics.put("volumeTrend",             volumeTrend);
        metrics.put("correlation",             correlation);
        metrics.put("inflowVolumeCorrelation", inflowVolumeCorrelation);
        metrics.put("priceVolatility",         priceVolatility);
        metrics.put("recentInflowTrend",       recentInflowTrend);
        metrics.put("stageRule",               STAGE_RULES.matchingRule(signals));

        return new TrendResult(
            fundingTrend(inflowDirection, inflowLine.strength()),
            outcome.confidence(),
            netInflowTotal,
            netInflowRecent,
            outcome.stage(),
            outcome.reasons(),
            Collections.unmodifiableMap(metrics));
    }

    /**
     * Maps inflow regression direction and strength to the trend label:
     * strength &gt; 0.5 is a full trend, &gt; 0.3 a slight one, otherwise neutral.
     */
    public static FundingTrend fundingTrend(TrendDirection direction, double strength) {
        boolean up = direction == TrendDirection.UP;
        if (strength > STRONG_TREND) return up ? FundingTrend.INCREASING : FundingTrend.DECREASING;
        if (strength > SLIGHT_TREND) return up ? FundingTrend.SLIGHTLY_INCREASING : FundingTrend.SLIGHTLY_DECREASING;
        return FundingTrend.NEUTRAL;
    }

    static double volatility(double[] prices) {
        double meanPrice = Statistics.mean(prices);
        if (meanPrice == 0.0) return 0.0;
        return Statistics.populationStdDev(Statistics.deltas(prices)) / meanPrice;
    }

    private static StageOutcome fallbackStage(Signals s) {
        if (s.priceTrend() > 0.5) {
            if (s.inflowTrend() > 0.5) {
                return StageOutcome.of(MarketStage.UPTREND,
                    (s.priceTrend() + s.inflowTrend()) / 2,
                    "Price and net inflow both lean upward");
            }
            return StageOutcome.of(MarketStage.WEAKENING_UPTREND,
                s.priceTrend() * (1 - s.inflowTrend()),
                "Price rising but net inflow weakening");
        }
        if (s.inflowTrend() < 0.5) {
            return StageOutcome.of(MarketStage.DOWNTREND,
                (1 - s.priceTrend() + 1 - s.inflowTrend()) / 2,
                "Price and net inflow both lean downward");
        }
        return StageOutcome.of(MarketStage.WEAKENING_DOWNTREND,
            (1 - s.priceTrend()) * s.inflowTrend(),
            "Price falling but net inflow strengthening");
    }

    private static String strengths(Signals s) {
        return String.format(Locale.ROOT, "Price trend strength: %.2f, inflow trend strength: %.2f",
            s.priceTrendStrength(), s.inflowTrendStrength());
    }
}
