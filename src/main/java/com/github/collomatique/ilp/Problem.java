package com.github.collomatique.ilp;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.collomatique.ilp.repr.ProblemRepr;
import com.github.collomatique.ilp.repr.ReprKind;

import lombok.extern.slf4j.Slf4j;

/**
 * Boolean problem: ordered variables, constraints and an objective to minimise.
 * Constants declared on the builder are substituted into the constraints at build time.
 * <p>
 * Immutable once built. The representation is shared by every {@link Config} of the problem.
 */
public final class Problem<V> {

    private final List<V> variables;
    private final Map<V, Integer> lookup;
    private final Map<V, Boolean> constants;
    private final List<Constraint<V>> constraints;
    private final LinExpr<V> objective;
    private final ProblemRepr repr;

    private Problem(List<V> variables, Map<V, Boolean> constants, List<Constraint<V>> constraints,
            LinExpr<V> objective, ReprKind reprKind) {
        this.variables = List.copyOf(variables);
        this.lookup = new HashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            lookup.put(variables.get(i), i);
        }
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
        this.constraints = List.copyOf(constraints);
        this.objective = objective.cleaned();
        this.repr = reprKind.create(variables.size(),
                constraints.stream().map(c -> c.transmute(lookup::get)).toList());
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    public List<V> variables() {
        return variables;
    }

    public Map<V, Boolean> constants() {
        return constants;
    }

    public List<Constraint<V>> constraints() {
        return constraints;
    }

    public LinExpr<V> objective() {
        return objective;
    }

    public ProblemRepr repr() {
        return repr;
    }

    public Optional<Integer> indexOf(V var) {
        return Optional.ofNullable(lookup.get(var));
    }

    public Config<V> defaultConfig() {
        return new Config<>(this, repr.defaultConfig(), null);
    }

    public Config<V> configFrom(Collection<? extends V> ones) {
        var bits = new BitSet(variables.size());
        for (var var : ones) {
            var index = lookup.get(var);
            if (index == null) {
                throw ModelException.invalid(var);
            }
            bits.set(index);
        }
        return new Config<>(this, repr.configFrom(bits), null);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        sb.append("variables: ").append(variables).append('\n');
        if (!constants.isEmpty()) {
            sb.append("constants: ").append(constants).append('\n');
        }
        sb.append("constraints:\n");
        for (int i = 0; i < constraints.size(); i++) {
            sb.append(String.format("  %d) %s%n", i, constraints.get(i)));
        }
        sb.append("objective: ").append(objective);
        return sb.toString();
    }

    @Slf4j
    public static final class Builder<V> {
        private final Set<V> variables = new LinkedHashSet<>();
        private final Map<V, Boolean> constants = new LinkedHashMap<>();
        private final Set<Constraint<V>> constraints = new LinkedHashSet<>();
        private LinExpr<V> objective = LinExpr.zero();

        private Builder() {}

        public Builder<V> addVariable(V var) {
            if (variables.contains(var) || constants.containsKey(var)) {
                throw ModelException.alreadyDeclared(var);
            }
            variables.add(var);
            return this;
        }

        public Builder<V> addVariables(Collection<? extends V> vars) {
            vars.forEach(this::addVariable);
            return this;
        }

        public Builder<V> addConstant(V var, boolean value) {
            if (variables.contains(var) || constants.containsKey(var)) {
                throw ModelException.alreadyDeclared(var);
            }
            constants.put(var, value);
            return this;
        }

        public boolean isDeclared(V var) {
            return variables.contains(var) || constants.containsKey(var);
        }

        public Builder<V> addConstraint(Constraint<V> constraint) {
            checkDeclared(constraint.variables());
            constraints.add(constraint);
            return this;
        }

        public Builder<V> addConstraints(Collection<Constraint<V>> constraints) {
            constraints.forEach(this::addConstraint);
            return this;
        }

        public Builder<V> objective(LinExpr<V> objective) {
            checkDeclared(objective.variables());
            this.objective = objective;
            return this;
        }

        private void checkDeclared(Set<V> vars) {
            for (var var : vars) {
                if (!isDeclared(var)) {
                    throw ModelException.undeclared(var);
                }
            }
        }

        public Problem<V> build() {
            return build(ReprKind.DENSE);
        }

        public Problem<V> build(ReprKind reprKind) {
            List<Constraint<V>> reduced = new ArrayList<>();
            var seen = new LinkedHashSet<Constraint<V>>();
            for (var constraint : constraints) {
                var r = constraint.reduce(constants);
                if (r.isTrivial() && r.getSign().accepts(r.getConstant())) {
                    continue;
                }
                if (seen.add(r)) {
                    reduced.add(r);
                }
            }
            log.debug("building problem with {} variables, {} constants and {} constraints ({} after reduction)",
                    variables.size(), constants.size(), constraints.size(), reduced.size());
            return new Problem<>(new ArrayList<>(variables), constants, reduced, objective.reduce(constants), reprKind);
        }
    }
}
