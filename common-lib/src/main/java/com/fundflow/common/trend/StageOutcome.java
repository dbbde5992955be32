package com.fundflow.common.trend;

import com.fundflow.common.model.MarketStage;

import java.util.List;

/**
 * Stage label, its confidence and the diagnostic reasons that justified it.
 */
public record StageOutcome(MarketStage stage, double confidence, List<String> reasons) {

    public static StageOutcome of(MarketStage stage, double confidence, String... reasons) {
        return new StageOutcome(stage, confidence, List.of(reasons));
    }
}
