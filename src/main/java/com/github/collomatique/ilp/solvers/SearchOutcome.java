package com.github.collomatique.ilp.solvers;

import java.util.Optional;

import com.github.collomatique.ilp.FeasableConfig;

/**
 * Result of a feasibility search. Not finding a solution is an ordinary outcome.
 */
public sealed interface SearchOutcome<V> {

    enum Reason {
        STEP_BUDGET,
        DEADLINE,
        CANCELLED,
    }

    long steps();

    default Optional<FeasableConfig<V>> config() {
        return Optional.empty();
    }

    record Found<V>(FeasableConfig<V> feasable, long steps) implements SearchOutcome<V> {
        @Override
        public Optional<FeasableConfig<V>> config() {
            return Optional.of(feasable);
        }
    }

    /** Every config reachable from the start was explored. */
    record NotFound<V>(long steps) implements SearchOutcome<V> {}

    record TimeLimit<V>(Reason reason, long steps) implements SearchOutcome<V> {}
}
