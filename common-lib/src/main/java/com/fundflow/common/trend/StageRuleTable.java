package com.fundflow.common.trend;

import java.util.List;
import java.util.function.Function;

/**
 * Ordered stage rules with a fallback. Rules are evaluated top to bottom and the first
 * match wins; the fallback applies when none match. New stages are added by inserting a
 * rule at the right priority.
 *
 * @param <T> the metrics bundle the rules read
 */
public final class StageRuleTable<T> {

    private final List<StageRule<T>> rules;
    private final Function<T, StageOutcome> fallback;

    public StageRuleTable(List<StageRule<T>> rules, Function<T, StageOutcome> fallback) {
        this.rules    = List.copyOf(rules);
        this.fallback = fallback;
    }

    public StageOutcome resolve(T inputs) {
        for (StageRule<T> rule : rules) {
            if (rule.matches().test(inputs)) {
                return rule.outcome().apply(inputs);
            }
        }
        return fallback.apply(inputs);
    }

    /** Name of the rule that would fire, or {@code "fallback"}. */
    public String matchingRule(T inputs) {
        return rules.stream()
            .filter(rule -> rule.matches().test(inputs))
            .map(StageRule::name)
            .findFirst()
            .orElse("fallback");
    }

    public List<StageRule<T>> rules() {
        return rules;
    }
}
