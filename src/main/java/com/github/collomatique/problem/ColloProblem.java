package com.github.collomatique.problem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.collomatique.eval.Origin;
import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.Constraint;
import com.github.collomatique.ilp.FeasableConfig;
import com.github.collomatique.ilp.ModelException;
import com.github.collomatique.ilp.Problem;
import com.github.collomatique.problem.ProblemVar.Base;
import com.github.collomatique.problem.ProblemVar.Helper;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A problem assembled from scripts, with the bookkeeping needed to explain its constraints and
 * to complete a host assignment with the values of reified variables.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class ColloProblem<V> {

    public sealed interface ConstraintDesc<V> {

        /** Produced by calling {@code call} on {@code script}; {@code origin} is the innermost function. */
        record FromScript<V>(ScriptRef script, FnCall call, Optional<Origin> origin) implements ConstraintDesc<V> {
            @Override
            public String toString() {
                return script.name() + ": " + origin.map(Origin::toString).orElse(call.toString());
            }
        }

        /** Ties a reified variable to its definition. */
        record Reification<V>(ProblemVar<V> var) implements ConstraintDesc<V> {
            @Override
            public String toString() {
                return "definition of " + var;
            }
        }
    }

    public record DescribedConstraint<V>(Constraint<ProblemVar<V>> constraint, ConstraintDesc<V> desc) {
        @Override
        public String toString() {
            return constraint + " [" + desc + "]";
        }
    }

    private final Problem<ProblemVar<V>> problem;
    /** Free host variables. */
    private final Set<V> baseVars;
    private final Map<V, Boolean> fixedVars;
    /** Inequalities defining each reified variable, helpers refer to them by index. */
    private final Map<ProblemVar<V>, List<Constraint<ProblemVar<V>>>> definitions;
    private final List<DescribedConstraint<V>> constraints;

    public Solution<V> solution(Config<ProblemVar<V>> config) {
        if (config.problem() != problem) {
            throw new IllegalArgumentException("config belongs to another problem");
        }
        return new Solution<>(this, config);
    }

    public Solution<V> solution(FeasableConfig<ProblemVar<V>> config) {
        return solution(config.inner());
    }

    /**
     * Completes an assignment of the free host variables: reified variables and helpers take the
     * value their definition has under it.
     *
     * @param ones the free host variables set to one, every other one is zero
     */
    public Solution<V> solutionFromData(Set<V> ones) {
        for (var var : ones) {
            if (!baseVars.contains(var)) {
                throw ModelException.invalid(var);
            }
        }
        Map<ProblemVar<V>, Boolean> values = new HashMap<>();
        List<ProblemVar<V>> set = new ArrayList<>();
        for (var var : problem.variables()) {
            if (valueOf(var, ones, values)) {
                set.add(var);
            }
        }
        return new Solution<>(this, problem.configFrom(set));
    }

    private boolean valueOf(ProblemVar<V> var, Set<V> ones, Map<ProblemVar<V>, Boolean> values) {
        var known = values.get(var);
        if (known != null) {
            return known;
        }
        boolean value;
        if (var instanceof Base<V> base) {
            value = fixedVars.containsKey(base.var()) ? fixedVars.get(base.var()) : ones.contains(base.var());
        } else if (var instanceof Helper<V> helper) {
            var inequality = definitions.get(helper.reified()).get(helper.index());
            value = inequality.isSatisfied(v -> valueOf(v, ones, values));
        } else {
            value = definitions.get(var).stream().allMatch(c -> c.isSatisfied(v -> valueOf(v, ones, values)));
        }
        values.put(var, value);
        return value;
    }
}
