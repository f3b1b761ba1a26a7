package com.github.collomatique.ilp.solvers;

import java.util.Set;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.FeasableConfig;

public interface FeasabilitySolver<V> {

    /**
     * Looks for a feasible config close to {@code start} that is not in {@code excluded}.
     * Implementations must keep all their search state local so that several calls can run
     * concurrently on the same problem.
     */
    SearchOutcome<V> restoreFeasability(Config<V> start, Set<FeasableConfig<V>> excluded, SearchLimits limits);

    default SearchOutcome<V> restoreFeasability(Config<V> start) {
        return restoreFeasability(start, Set.of(), SearchLimits.unlimited());
    }
}
