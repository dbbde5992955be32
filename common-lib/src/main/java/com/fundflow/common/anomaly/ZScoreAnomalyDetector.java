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
 * Legacy anomaly scan: z-scores over raw base volume and raw net inflow.
 *
 * <p>A bar produces at most one record, merging every component that fired:
 * <ul>
 *   <li>{@link AnomalyType#VOLUME_OUTLIER}: |volume z| &gt; 2</li>
 *   <li>{@link AnomalyType#NET_INFLOW_OUTLIER}: |net inflow z| &gt; 2</li>
 *   <li>{@link AnomalyType#PRICE_VOLUME_MISMATCH}: |priceChangePct| &gt; 1 while volume z &lt; 0</li>
 * </ul>
 * Only the most recent {@value #MAX_RECORDS} records are reported.
 */
public class ZScoreAnomalyDetector implements AnomalyDetector {

    static final int MAX_RECORDS = 5;

    private static final double Z_THRESHOLD        = 2.0;
    private static final double MISMATCH_PRICE_PCT = 1.0;

    @Override
    public AnomalyMode mode() {
        return AnomalyMode.ZSCORE;
    }

    @Override
    public AnomalyReport detect(List<Bar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            return AnomalyReport.empty(mode());
        }

        double[] volumes = bars.stream().mapToDouble(Bar::volume).toArray();
        double[] inflows = bars.stream().mapToDouble(Bar::netInflow).toArray();

        double volMean    = Statistics.mean(volumes);
        double volStd     = Statistics.populationStdDev(volumes);
        double inflowMean = Statistics.mean(inflows);
        double inflowStd  = Statistics.populationStdDev(inflows);

        List<AnomalyRecord> records = new ArrayList<>();
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            double volZ    = Statistics.zScore(volumes[i], volMean, volStd);
            double inflowZ = Statistics.zScore(inflows[i], inflowMean, inflowStd);

            List<AnomalyType> types = new ArrayList<>();
            Deviation volume = null;
            Deviation inflow = null;
            PriceVolumeMismatch mismatch = null;

            if (Math.abs(volZ) > Z_THRESHOLD) {
                types.add(AnomalyType.VOLUME_OUTLIER);
                volume = new Deviation(volumes[i], volZ, Direction.ofSign(volZ));
            }
            if (Math.abs(inflowZ) > Z_THRESHOLD) {
                types.add(AnomalyType.NET_INFLOW_OUTLIER);
                inflow = new Deviation(inflows[i], inflowZ, Direction.ofSign(inflowZ));
            }
            if (Math.abs(bar.priceChangePct()) > MISMATCH_PRICE_PCT && volZ < 0) {
                types.add(AnomalyType.PRICE_VOLUME_MISMATCH);
                mismatch = new PriceVolumeMismatch(bar.priceChangePct(), volZ);
            }

            if (!types.isEmpty()) {
                records.add(new AnomalyRecord(bar.openTime(), List.copyOf(types),
                    volume, inflow, mismatch, null));
            }
        }

        int from = Math.max(0, records.size() - MAX_RECORDS);
        return AnomalyReport.of(mode(), records.subList(from, records.size()));
    }
}
