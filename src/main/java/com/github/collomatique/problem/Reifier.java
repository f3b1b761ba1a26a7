package com.github.collomatique.problem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.IntFunction;

import com.github.collomatique.ilp.Constraint;
import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.ilp.Sign;

/**
 * Linearizes {@code r <=> (c_1 and ... and c_k)} for a binary {@code r} and constraints over
 * binary variables.
 * <p>
 * Each {@code c_j} is first split into inequalities {@code e <= 0}. An indicator {@code x} of
 * {@code e <= 0}, where {@code e} ranges over {@code [L, U]}, is tied to it with
 * {@code e + U*x - U <= 0} and {@code 1 - e + (L-1)*x <= 0}. With a single inequality {@code r}
 * is that indicator, with several each gets a helper {@code d_j} and {@code r <= d_j},
 * {@code sum(d_j) - r <= k - 1}. An empty conjunction fixes {@code r = 1}.
 */
public final class Reifier {

    public record Reification<W>(List<Constraint<W>> inequalities, List<W> helpers, List<Constraint<W>> constraints) {}

    private Reifier() {}

    public static <W> Reification<W> reify(W var, Collection<Constraint<W>> definition, IntFunction<W> helper) {
        var inequalities = inequalities(definition);
        List<Constraint<W>> constraints = new ArrayList<>();
        List<W> helpers = new ArrayList<>();
        LinExpr<W> r = LinExpr.var(var);

        if (inequalities.isEmpty()) {
            constraints.add(r.eq(LinExpr.constant(1)));
        } else if (inequalities.size() == 1) {
            constraints.addAll(indicator(var, inequalities.get(0).expr()));
        } else {
            LinExpr<W> sum = LinExpr.zero();
            for (int j = 0; j < inequalities.size(); j++) {
                var d = helper.apply(j);
                helpers.add(d);
                constraints.addAll(indicator(d, inequalities.get(j).expr()));
                constraints.add(r.leq(LinExpr.var(d)));
                sum = sum.plus(LinExpr.var(d));
            }
            constraints.add(sum.minus(r).leq(LinExpr.constant(inequalities.size() - 1)));
        }
        return new Reification<>(inequalities, helpers, constraints);
    }

    /** Splits equalities so that every returned constraint reads {@code e <= 0}. */
    public static <W> List<Constraint<W>> inequalities(Collection<Constraint<W>> constraints) {
        List<Constraint<W>> result = new ArrayList<>();
        for (var constraint : constraints) {
            result.add(new Constraint<>(constraint.expr(), Sign.LESS_THAN));
            if (constraint.getSign() == Sign.EQUALS) {
                result.add(new Constraint<>(constraint.expr().negate(), Sign.LESS_THAN));
            }
        }
        return result;
    }

    private static <W> List<Constraint<W>> indicator(W x, LinExpr<W> e) {
        int lower = e.lowerBound();
        int upper = e.upperBound();
        LinExpr<W> var = LinExpr.var(x);
        var whenSet = e.plus(var.times(upper)).minus(upper);
        var whenUnset = LinExpr.<W>constant(1).minus(e).plus(var.times(Math.subtractExact(lower, 1)));
        return List.of(new Constraint<>(whenSet, Sign.LESS_THAN), new Constraint<>(whenUnset, Sign.LESS_THAN));
    }
}
