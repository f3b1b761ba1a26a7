package com.github.collomatique.problem;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.FeasableConfig;
import com.github.collomatique.problem.ColloProblem.DescribedConstraint;
import com.github.collomatique.problem.ProblemVar.Base;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/** A possibly infeasible assignment of a {@link ColloProblem}. */
@RequiredArgsConstructor
public final class Solution<V> {

    @Getter
    @Accessors(fluent = true)
    private final ColloProblem<V> problem;
    @Getter
    @Accessors(fluent = true)
    private final Config<ProblemVar<V>> config;

    public boolean isFeasable() {
        return config.isFeasable();
    }

    public Optional<FeasableConfig<ProblemVar<V>>> intoFeasable() {
        return config.intoFeasable();
    }

    public boolean get(V var) {
        return config.get(new Base<>(var));
    }

    /** Host variables set to one, fixed ones included. */
    public Set<V> data() {
        Set<V> result = new LinkedHashSet<>();
        problem.fixedVars().forEach((var, value) -> {
            if (value) {
                result.add(var);
            }
        });
        for (var var : problem.baseVars()) {
            if (config.get(new Base<>(var))) {
                result.add(var);
            }
        }
        return result;
    }

    /** Values of every problem variable, reified ones and helpers included. */
    public Map<ProblemVar<V>, Boolean> completeData() {
        Map<ProblemVar<V>, Boolean> result = new LinkedHashMap<>();
        for (var var : config.problem().variables()) {
            result.put(var, config.get(var));
        }
        return result;
    }

    public int objectiveValue() {
        return config.objectiveValue();
    }

    /** Constraints this assignment violates, with where they come from. */
    public List<DescribedConstraint<V>> blame() {
        return problem.constraints().stream()
                .filter(c -> !c.constraint().isSatisfied(config::get))
                .toList();
    }

    @Override
    public String toString() {
        return "Solution" + data();
    }
}
