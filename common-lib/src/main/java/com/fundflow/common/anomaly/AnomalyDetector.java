package com.fundflow.common.anomaly;

import com.fundflow.common.model.AnomalyMode;
import com.fundflow.common.model.AnomalyReport;
import com.fundflow.common.model.Bar;

import java.util.List;

/**
 * Strategy contract for scanning a bar window for statistical outliers.
 *
 * <p>Implementations are stateless and pure. Windows shorter than {@link #MIN_BARS}
 * yield {@link AnomalyReport#empty(AnomalyMode)}.
 */
public interface AnomalyDetector {

    int MIN_BARS = 5;

    AnomalyReport detect(List<Bar> bars);

    AnomalyMode mode();

    static AnomalyDetector forMode(AnomalyMode mode) {
        return switch (mode) {
            case RATIO  -> new RatioAnomalyDetector();
            case ZSCORE -> new ZScoreAnomalyDetector();
        };
    }
}
