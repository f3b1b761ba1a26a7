package com.github.collomatique.ilp.solvers;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.FeasableConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * Breadth-first exploration of the single-flip neighbourhood of the start config. The first
 * feasible config not in the exclusion set is therefore one of the closest.
 */
@Slf4j
public class BfsSolver<V> implements FeasabilitySolver<V> {

    @Override
    public SearchOutcome<V> restoreFeasability(Config<V> start, Set<FeasableConfig<V>> excluded, SearchLimits limits) {
        var frontier = new ArrayDeque<Config<V>>();
        Set<BitSet> visited = new HashSet<>();
        frontier.add(start);
        visited.add(start.repr().ones());

        long steps = 0;
        while (!frontier.isEmpty()) {
            var candidate = frontier.poll();
            var feasable = candidate.intoFeasable();
            if (feasable.isPresent() && !excluded.contains(feasable.get())) {
                log.debug("feasible config found after {} steps", steps);
                return new SearchOutcome.Found<>(feasable.get(), steps);
            }

            var stop = limits.consumeStep(steps);
            if (stop.isPresent()) {
                log.debug("search stopped after {} steps: {}", steps, stop.get());
                return new SearchOutcome.TimeLimit<>(stop.get(), steps);
            }
            steps++;

            for (var neighbour : candidate.neighbours()) {
                if (visited.add(neighbour.repr().ones())) {
                    frontier.add(neighbour);
                }
            }
        }
        log.debug("search space exhausted after {} steps", steps);
        return new SearchOutcome.NotFound<>(steps);
    }
}
