package com.github.collomatique.ilp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Linear expression {@code sum(c_i * x_i) + k} over variables of type {@code V}.
 * <p>
 * Arithmetic returns new expressions. Only {@link #clean()} mutates, and only by dropping
 * zero coefficients, so equality (which is defined on the cleaned form) is never affected.
 */
public final class LinExpr<V> {

    private final Map<V, Integer> coefs;
    private final int constant;

    private LinExpr(Map<V, Integer> coefs, int constant) {
        this.coefs = coefs;
        this.constant = constant;
    }

    public static <V> LinExpr<V> var(V var) {
        var coefs = new LinkedHashMap<V, Integer>();
        coefs.put(var, 1);
        return new LinExpr<>(coefs, 0);
    }

    public static <V> LinExpr<V> constant(int constant) {
        return new LinExpr<>(new LinkedHashMap<>(), constant);
    }

    public static <V> LinExpr<V> zero() {
        return constant(0);
    }

    public static <V> LinExpr<V> of(Map<V, Integer> coefs, int constant) {
        return new LinExpr<>(new LinkedHashMap<>(coefs), constant);
    }

    public Optional<Integer> get(V var) {
        return Optional.ofNullable(coefs.get(var));
    }

    public int getConstant() {
        return constant;
    }

    public Set<V> variables() {
        return Collections.unmodifiableSet(coefs.keySet());
    }

    public Map<V, Integer> coefficients() {
        return Collections.unmodifiableMap(coefs);
    }

    public LinExpr<V> plus(LinExpr<V> other) {
        var result = new LinkedHashMap<>(coefs);
        other.coefs.forEach((v, c) -> result.merge(v, c, Math::addExact));
        return new LinExpr<>(result, Math.addExact(constant, other.constant));
    }

    public LinExpr<V> plus(int value) {
        return new LinExpr<>(new LinkedHashMap<>(coefs), Math.addExact(constant, value));
    }

    public LinExpr<V> minus(LinExpr<V> other) {
        return plus(other.negate());
    }

    public LinExpr<V> minus(int value) {
        return plus(Math.negateExact(value));
    }

    public LinExpr<V> times(int factor) {
        var result = new LinkedHashMap<V, Integer>();
        coefs.forEach((v, c) -> result.put(v, Math.multiplyExact(c, factor)));
        return new LinExpr<>(result, Math.multiplyExact(constant, factor));
    }

    public LinExpr<V> negate() {
        return times(-1);
    }

    public void clean() {
        coefs.values().removeIf(c -> c == 0);
    }

    public LinExpr<V> cleaned() {
        var copy = new LinExpr<>(new LinkedHashMap<>(coefs), constant);
        copy.clean();
        return copy;
    }

    public Constraint<V> leq(LinExpr<V> other) {
        return new Constraint<>(this.minus(other), Sign.LESS_THAN);
    }

    public Constraint<V> geq(LinExpr<V> other) {
        return other.leq(this);
    }

    public Constraint<V> eq(LinExpr<V> other) {
        return new Constraint<>(this.minus(other), Sign.EQUALS);
    }

    public int eval(Predicate<? super V> isSet) {
        int result = constant;
        for (var entry : coefs.entrySet()) {
            if (isSet.test(entry.getKey())) {
                result = Math.addExact(result, entry.getValue());
            }
        }
        return result;
    }

    /** Substitutes the given fixed values, keeping every other variable. */
    public LinExpr<V> reduce(Map<V, Boolean> fixed) {
        var result = new LinkedHashMap<V, Integer>();
        int newConstant = constant;
        for (var entry : coefs.entrySet()) {
            var value = fixed.get(entry.getKey());
            if (value == null) {
                result.put(entry.getKey(), entry.getValue());
            } else if (value) {
                newConstant = Math.addExact(newConstant, entry.getValue());
            }
        }
        return new LinExpr<>(result, newConstant);
    }

    /** Renames variables; coefficients of variables mapped to the same name are summed. */
    public <U> LinExpr<U> transmute(Function<? super V, ? extends U> mapping) {
        var result = new LinkedHashMap<U, Integer>();
        coefs.forEach((v, c) -> result.merge(mapping.apply(v), c, Math::addExact));
        return new LinExpr<>(result, constant);
    }

    /** Smallest value reachable with 0/1 variables. */
    public int lowerBound() {
        int result = constant;
        for (int c : coefs.values()) {
            if (c < 0) {
                result = Math.addExact(result, c);
            }
        }
        return result;
    }

    /** Largest value reachable with 0/1 variables. */
    public int upperBound() {
        int result = constant;
        for (int c : coefs.values()) {
            if (c > 0) {
                result = Math.addExact(result, c);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LinExpr<?> other)) {
            return false;
        }
        return constant == other.constant && cleaned().coefs.equals(other.cleaned().coefs);
    }

    @Override
    public int hashCode() {
        return 31 * cleaned().coefs.hashCode() + constant;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var entry : coefs.entrySet()) {
            int c = entry.getValue();
            if (c == 0) {
                continue;
            }
            if (sb.length() == 0) {
                sb.append(c < 0 ? "-" : "");
            } else {
                sb.append(c < 0 ? " - " : " + ");
            }
            if (Math.abs(c) != 1) {
                sb.append(Math.abs(c)).append('*');
            }
            sb.append(entry.getKey());
        }
        if (sb.length() == 0) {
            return Integer.toString(constant);
        }
        if (constant != 0) {
            sb.append(constant < 0 ? " - " : " + ").append(Math.abs(constant));
        }
        return sb.toString();
    }
}
