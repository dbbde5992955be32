package com.fundflow.common.trend;

import com.fundflow.common.model.MarketStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StageRuleTableTest {

    private final StageRuleTable<Integer> table = new StageRuleTable<>(List.of(
        StageRule.of("big", n -> n > 100, n -> StageOutcome.of(MarketStage.TOP, 0.9, "big")),
        StageRule.of("positive", n -> n > 0, n -> StageOutcome.of(MarketStage.UPTREND, 0.6, "positive"))
    ), n -> StageOutcome.of(MarketStage.CONSOLIDATION, 0.1));

    @Test
    @DisplayName("first matching rule wins")
    void firstMatchWins() {
        assertEquals(MarketStage.TOP, table.resolve(500).stage());
        assertEquals("big", table.matchingRule(500));
        assertEquals(MarketStage.UPTREND, table.resolve(5).stage());
    }

    @Test
    @DisplayName("no match → fallback")
    void fallback() {
        StageOutcome outcome = table.resolve(-1);
        assertEquals(MarketStage.CONSOLIDATION, outcome.stage());
        assertTrue(outcome.reasons().isEmpty());
        assertEquals("fallback", table.matchingRule(-1));
    }

    @Test
    @DisplayName("rules are kept in order and immutable")
    void rulesImmutable() {
        assertEquals("big", table.rules().get(0).name());
        assertThrows(UnsupportedOperationException.class, () -> table.rules().clear());
    }
}
