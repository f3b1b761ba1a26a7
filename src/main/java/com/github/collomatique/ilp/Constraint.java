package com.github.collomatique.ilp;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A constraint in normalized form {@code expr = 0} or {@code expr <= 0}.
 * The expression is stored cleaned.
 */
public final class Constraint<V> {

    private final LinExpr<V> expr;
    private final Sign sign;

    public Constraint(LinExpr<V> expr, Sign sign) {
        this.expr = expr.cleaned();
        this.sign = sign;
    }

    public LinExpr<V> expr() {
        return expr;
    }

    public Sign getSign() {
        return sign;
    }

    public Optional<Integer> getVar(V var) {
        return expr.get(var);
    }

    public int getConstant() {
        return expr.getConstant();
    }

    public Set<V> variables() {
        return expr.variables();
    }

    public boolean isSatisfied(Predicate<? super V> isSet) {
        return sign.accepts(expr.eval(isSet));
    }

    public Constraint<V> reduce(Map<V, Boolean> fixed) {
        return new Constraint<>(expr.reduce(fixed), sign);
    }

    public <U> Constraint<U> transmute(Function<? super V, ? extends U> mapping) {
        return new Constraint<>(expr.transmute(mapping), sign);
    }

    /** True when the constraint has no variable left. */
    public boolean isTrivial() {
        return expr.variables().isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Constraint<?> other && sign == other.sign && expr.equals(other.expr);
    }

    @Override
    public int hashCode() {
        return 31 * expr.hashCode() + sign.hashCode();
    }

    @Override
    public String toString() {
        return expr + " " + sign + " 0";
    }
}
