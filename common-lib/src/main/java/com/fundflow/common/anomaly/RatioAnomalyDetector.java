package com.fundflow.common.anomaly;

import com.fundflow.common.model.AnomalyMode;
import com.fundflow.common.model.AnomalyRecord;
import com.fundflow.common.model.AnomalyReport;
import com.fundflow.common.model.AnomalyType;
import com.fundflow.common.model.Bar;
import com.fundflow.common.model.Deviation;
import com.fundflow.common.model.Direction;
import com.fundflow.common.model.PriceVolumeMismatch;
import com.fundflow.common.stats.Statistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Primary anomaly scan over quote volume and relative price change.
 *
 * <p>Window statistics: population mean / std-dev of {@code quoteVolume} and of
 * {@code |close - open| / open}. Each bar is then checked against four independent
 * rules, and every hit becomes its own {@link AnomalyRecord}:
 *
 * <pre>
 * HIGH_VOLUME_LOW_PRICE_CHANGE: quoteVolume &gt; μv + 2σv   and change &lt; μp + 0.5σp
 * HIGH_PRICE_CHANGE_LOW_VOLUME: change &gt; μp + 2σp        and quoteVolume &lt; μv + 0.5σv
 * EXTREME_NET_INFLOW:           netInflow &gt; 0 and netInflow &gt; 0.7 × quoteVolume
 * EXTREME_NET_OUTFLOW:          netInflow &lt; 0 and |netInflow| &gt; 0.7 × quoteVolume
 * </pre>
 *
 * <p>Extreme-flow records carry a fixed deviation of ±2.0: no distribution of the inflow
 * ratio is tracked. Records keep bar order and are never truncated.
 */
public class RatioAnomalyDetector implements AnomalyDetector {

    private static final double SPIKE_SIGMAS     = 2.0;
    private static final double QUIET_SIGMAS     = 0.5;
    private static final double EXTREME_FLOW     = 0.7;
    private static final double FLOW_DEVIATION   = 2.0;

    @Override
    public AnomalyMode mode() {
        return AnomalyMode.RATIO;
    }

    @Override
    public AnomalyReport detect(List<Bar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            return AnomalyReport.empty(mode());
        }

        double[] volumes = bars.stream().mapToDouble(Bar::quoteVolume).toArray();
        double[] changes = bars.stream().mapToDouble(Bar::absoluteChangeFraction).toArray();

        double volMean    = Statistics.mean(volumes);
        double volStd     = Statistics.populationStdDev(volumes);
        double changeMean = Statistics.mean(changes);
        double changeStd  = Statistics.populationStdDev(changes);

        List<AnomalyRecord> records = new ArrayList<>();
        for (int i = 0; i < bars.size(); i++) {
            Bar bar       = bars.get(i);
            double volume = volumes[i];
            double change = changes[i];
            double volZ   = Statistics.zScore(volume, volMean, volStd);

            if (volume > volMean + SPIKE_SIGMAS * volStd && change < changeMean + QUIET_SIGMAS * changeStd) {
                records.add(new AnomalyRecord(bar.openTime(),
                    List.of(AnomalyType.HIGH_VOLUME_LOW_PRICE_CHANGE),
                    new Deviation(volume, volZ, Direction.HIGH),
                    null, null, null));
            }

            if (change > changeMean + SPIKE_SIGMAS * changeStd && volume < volMean + QUIET_SIGMAS * volStd) {
                records.add(new AnomalyRecord(bar.openTime(),
                    List.of(AnomalyType.HIGH_PRICE_CHANGE_LOW_VOLUME),
                    null, null,
                    new PriceVolumeMismatch(change * 100.0, volZ),
                    null));
            }

            double inflow = bar.netInflow();
            if (inflow > 0 && inflow > EXTREME_FLOW * volume) {
                records.add(new AnomalyRecord(bar.openTime(),
                    List.of(AnomalyType.EXTREME_NET_INFLOW),
                    null,
                    new Deviation(inflow, FLOW_DEVIATION, Direction.HIGH),
                    null,
                    volume > 0 ? inflow / volume : 0.0));
            }

            if (inflow < 0 && Math.abs(inflow) > EXTREME_FLOW * volume) {
                records.add(new AnomalyRecord(bar.openTime(),
                    List.of(AnomalyType.EXTREME_NET_OUTFLOW),
                    null,
                    new Deviation(inflow, -FLOW_DEVIATION, Direction.LOW),
                    null,
                    volume > 0 ? Math.abs(inflow) / volume : 0.0));
            }
        }
        return AnomalyReport.of(mode(), records);
    }
}
