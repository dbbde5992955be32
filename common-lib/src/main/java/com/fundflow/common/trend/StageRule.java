package com.fundflow.common.trend;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of a {@link StageRuleTable}: when {@code matches} holds for the inputs,
 * {@code outcome} builds the stage result.
 *
 * @param <T> the metrics bundle the rule reads
 */
public record StageRule<T>(String name, Predicate<T> matches, Function<T, StageOutcome> outcome) {

    public static <T> StageRule<T> of(String name, Predicate<T> matches, Function<T, StageOutcome> outcome) {
        return new StageRule<>(name, matches, outcome);
    }
}
