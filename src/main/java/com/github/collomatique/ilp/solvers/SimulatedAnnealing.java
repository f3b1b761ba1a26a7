package com.github.collomatique.ilp.solvers;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.ToDoubleFunction;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.FeasableConfig;
import com.github.collomatique.ilp.Problem;

import lombok.extern.slf4j.Slf4j;

/**
 * Simulated annealing over feasible configs. Every step jumps to a random neighbour of the
 * current solution, restores feasibility from there (refusing to fall back on the current
 * solution) and accepts the result according to the {@link AcceptancePolicy}.
 */
@Slf4j
public class SimulatedAnnealing<V> {

    public record Step<V>(FeasableConfig<V> config, double cost) {}

    private final Problem<V> problem;
    private final FeasabilitySolver<V> solver;
    private Config<V> initConfig;
    private TemperatureProfile temperatureProfile = TemperatureProfile.defaultProfile();
    private AcceptancePolicy acceptancePolicy = AcceptancePolicy.metropolis();
    private ToDoubleFunction<FeasableConfig<V>> cost = FeasableConfig::objectiveValue;
    private SearchLimits stepLimits = SearchLimits.unlimited();

    public SimulatedAnnealing(Problem<V> problem, FeasabilitySolver<V> solver) {
        this.problem = problem;
        this.solver = solver;
        this.initConfig = problem.defaultConfig();
    }

    public SimulatedAnnealing<V> initConfig(Config<V> initConfig) {
        if (initConfig.problem() != problem) {
            throw new IllegalArgumentException("initial config belongs to another problem");
        }
        this.initConfig = initConfig;
        return this;
    }

    public SimulatedAnnealing<V> temperatureProfile(TemperatureProfile temperatureProfile) {
        this.temperatureProfile = temperatureProfile;
        return this;
    }

    public SimulatedAnnealing<V> acceptancePolicy(AcceptancePolicy acceptancePolicy) {
        this.acceptancePolicy = acceptancePolicy;
        return this;
    }

    public SimulatedAnnealing<V> cost(ToDoubleFunction<FeasableConfig<V>> cost) {
        this.cost = cost;
        return this;
    }

    /** Limits applied to each feasibility restoration. Cancellation also stops the iteration. */
    public SimulatedAnnealing<V> stepLimits(SearchLimits stepLimits) {
        this.stepLimits = stepLimits;
        return this;
    }

    /** Yields the current step after every move; a rejected move repeats the previous step. */
    public Iterator<Step<V>> iterate(Random random) {
        return new AnnealingIterator(random);
    }

    public Optional<Step<V>> bestIn(int maxIter, Random random) {
        var iterator = iterate(random);
        Step<V> best = null;
        for (int i = 0; i < maxIter && iterator.hasNext(); i++) {
            var step = iterator.next();
            if (best == null || step.cost() < best.cost()) {
                best = step;
            }
        }
        if (best != null) {
            log.info("annealing best cost {} after at most {} iterations", best.cost(), maxIter);
        }
        return Optional.ofNullable(best);
    }

    private class AnnealingIterator implements Iterator<Step<V>> {
        private final Random random;
        private Step<V> previous;
        private Config<V> current = initConfig;
        private int k;
        private Step<V> pending;
        private boolean exhausted;

        AnnealingIterator(Random random) {
            this.random = random;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !exhausted) {
                pending = advance();
                exhausted = pending == null;
            }
            return pending != null;
        }

        @Override
        public Step<V> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var result = pending;
            pending = null;
            return result;
        }

        private Step<V> advance() {
            if (stepLimits.cancellation().isCancelled()) {
                return null;
            }
            Set<FeasableConfig<V>> excluded = previous == null ? Set.of() : Set.of(previous.config());
            var outcome = solver.restoreFeasability(current, excluded, stepLimits);

            FeasableConfig<V> solution;
            if (outcome instanceof SearchOutcome.Found<V> found) {
                solution = found.feasable();
            } else if (previous != null && !(outcome instanceof SearchOutcome.TimeLimit<V> limit
                    && limit.reason() == SearchOutcome.Reason.CANCELLED)) {
                solution = previous.config();
            } else {
                log.debug("annealing stopped at step {}: {}", k, outcome);
                return null;
            }

            double solutionCost = cost.applyAsDouble(solution);
            double acceptance = 1.0;
            if (previous != null) {
                acceptance = acceptancePolicy.acceptance(previous.cost(), solutionCost, temperatureProfile.temperature(k));
            }
            k++;

            var step = new Step<>(solution, solutionCost);
            var neighbour = solution.inner().randomNeighbour(random);
            if (neighbour.isEmpty()) {
                return step;
            }
            current = neighbour.get();
            if (previous == null || acceptance >= random.nextDouble()) {
                previous = step;
            }
            return previous;
        }
    }
}
