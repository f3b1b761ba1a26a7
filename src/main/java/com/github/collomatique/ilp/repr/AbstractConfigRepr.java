package com.github.collomatique.ilp.repr;

import java.util.BitSet;

/**
 * Shared part of the dense and sparse assignments. Subclasses only know how to compute a
 * full set of row sums and how one column contributes to them.
 */
abstract class AbstractConfigRepr<P extends ProblemRepr> implements ConfigRepr {

    protected final P problem;
    protected final BitSet values;

    protected AbstractConfigRepr(P problem, BitSet values) {
        if (values.length() > problem.variableCount()) {
            throw new IllegalArgumentException("variable index " + (values.length() - 1)
                    + " out of range for " + problem.variableCount() + " variables");
        }
        this.problem = problem;
        this.values = values;
    }

    protected abstract ConfigRepr create(BitSet values);

    /** Adds {@code delta} times column {@code var} to the row sums. */
    protected abstract void applyColumn(Precomputation data, int var, int delta);

    @Override
    public P problem() {
        return problem;
    }

    @Override
    public boolean get(int var) {
        return values.get(var);
    }

    @Override
    public BitSet ones() {
        return (BitSet) values.clone();
    }

    @Override
    public ConfigRepr with(int var, boolean value) {
        if (var < 0 || var >= problem.variableCount()) {
            throw new IndexOutOfBoundsException("variable " + var);
        }
        var newValues = (BitSet) values.clone();
        newValues.set(var, value);
        return create(newValues);
    }

    @Override
    public void updatePrecomputation(Precomputation data) {
        data.checkOwner(problem);
        var changed = data.changedColumns(values);
        for (int var = changed.nextSetBit(0); var >= 0; var = changed.nextSetBit(var + 1)) {
            applyColumn(data, var, values.get(var) ? 1 : -1);
        }
        data.snapshot.clear();
        data.snapshot.or(values);
    }

    @Override
    public int[] computeLhs(Precomputation data) {
        data.checkOwner(problem);
        var result = new int[problem.constraintCount()];
        for (int i = 0; i < result.length; i++) {
            result[i] = data.lhs(problem.constraintRef(i));
        }
        return result;
    }

    @Override
    public boolean isFeasable(Precomputation data) {
        data.checkOwner(problem);
        for (int sum : data.leqSums) {
            if (sum > 0) {
                return false;
            }
        }
        for (int sum : data.eqSums) {
            if (sum != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int maxDistanceToConstraint(Precomputation data) {
        data.checkOwner(problem);
        int distance = 0;
        for (int sum : data.leqSums) {
            distance += Math.max(sum, 0);
        }
        for (int sum : data.eqSums) {
            distance += Math.abs(sum);
        }
        return distance;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof AbstractConfigRepr<?> other && problem == other.problem && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
