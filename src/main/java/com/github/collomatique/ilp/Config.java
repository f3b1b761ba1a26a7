package com.github.collomatique.ilp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import com.github.collomatique.ilp.repr.ConfigRepr;
import com.github.collomatique.ilp.repr.Precomputation;

/**
 * A 0/1 assignment of the variables of a {@link Problem}. Immutable; the row sums used by
 * the feasibility checks are computed lazily, starting from the parent's sums when the
 * config was obtained by flipping variables.
 */
public final class Config<V> {

    private final Problem<V> problem;
    private final ConfigRepr repr;
    private Precomputation inherited;
    private Precomputation precomputation;

    Config(Problem<V> problem, ConfigRepr repr, Precomputation inherited) {
        this.problem = problem;
        this.repr = repr;
        this.inherited = inherited;
    }

    public Problem<V> problem() {
        return problem;
    }

    public ConfigRepr repr() {
        return repr;
    }

    private synchronized Precomputation precomputation() {
        if (precomputation == null) {
            if (inherited != null) {
                precomputation = inherited.copy();
                repr.updatePrecomputation(precomputation);
                inherited = null;
            } else {
                precomputation = repr.precompute();
            }
        }
        return precomputation;
    }

    // hands the cached sums to a derived config without forcing their computation
    private synchronized Precomputation shareable() {
        return precomputation != null ? precomputation : inherited;
    }

    public boolean get(V var) {
        var index = problem.indexOf(var);
        if (index.isPresent()) {
            return repr.get(index.get());
        }
        var constant = problem.constants().get(var);
        if (constant == null) {
            throw ModelException.invalid(var);
        }
        return constant;
    }

    public Config<V> set(V var, boolean value) {
        var index = problem.indexOf(var).orElseThrow(() -> ModelException.invalid(var));
        return new Config<>(problem, repr.with(index, value), shareable());
    }

    public Config<V> neighbour(int i) {
        return new Config<>(problem, repr.neighbour(i), shareable());
    }

    public List<Config<V>> neighbours() {
        List<Config<V>> result = new ArrayList<>(problem.variables().size());
        for (int i = 0; i < problem.variables().size(); i++) {
            result.add(neighbour(i));
        }
        return result;
    }

    public Optional<Config<V>> randomNeighbour(Random random) {
        int count = problem.variables().size();
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(neighbour(random.nextInt(count)));
    }

    public Map<Constraint<V>, Integer> computeLhs() {
        var lhs = repr.computeLhs(precomputation());
        var result = new LinkedHashMap<Constraint<V>, Integer>();
        var constraints = problem.constraints();
        for (int i = 0; i < constraints.size(); i++) {
            result.put(constraints.get(i), lhs[i]);
        }
        return result;
    }

    public boolean isFeasable() {
        return repr.isFeasable(precomputation());
    }

    public int maxDistanceToConstraint() {
        return repr.maxDistanceToConstraint(precomputation());
    }

    public List<Constraint<V>> unsatisfiedConstraints() {
        List<Constraint<V>> result = new ArrayList<>();
        computeLhs().forEach((constraint, lhs) -> {
            if (!constraint.getSign().accepts(lhs)) {
                result.add(constraint);
            }
        });
        return result;
    }

    public Optional<FeasableConfig<V>> intoFeasable() {
        if (!isFeasable()) {
            return Optional.empty();
        }
        return Optional.of(new FeasableConfig<>(this));
    }

    /** Variables set to one, fixed constants included. */
    public Set<V> variablesSetToOne() {
        var result = new LinkedHashSet<V>();
        var ones = repr.ones();
        for (int i = ones.nextSetBit(0); i >= 0; i = ones.nextSetBit(i + 1)) {
            result.add(problem.variables().get(i));
        }
        problem.constants().forEach((var, value) -> {
            if (value) {
                result.add(var);
            }
        });
        return result;
    }

    public int objectiveValue() {
        return problem.objective().eval(this::get);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Config<?> other && problem == other.problem && repr.equals(other.repr);
    }

    @Override
    public int hashCode() {
        return repr.hashCode();
    }

    @Override
    public String toString() {
        return "Config" + variablesSetToOne();
    }
}
