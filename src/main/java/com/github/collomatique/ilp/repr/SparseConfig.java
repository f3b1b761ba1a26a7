package com.github.collomatique.ilp.repr;

import java.util.BitSet;

final class SparseConfig extends AbstractConfigRepr<SparseProblem> {

    SparseConfig(SparseProblem problem, BitSet values) {
        super(problem, values);
    }

    @Override
    protected ConfigRepr create(BitSet values) {
        return new SparseConfig(problem, values);
    }

    @Override
    public Precomputation precompute() {
        return new Precomputation(problem, sums(problem.leqRows), sums(problem.eqRows), (BitSet) values.clone());
    }

    private int[] sums(SparseProblem.Row[] rows) {
        var result = new int[rows.length];
        for (int r = 0; r < rows.length; r++) {
            var row = rows[r];
            int sum = row.constant();
            for (int k = 0; k < row.columns().length; k++) {
                if (values.get(row.columns()[k])) {
                    sum += row.coefs()[k];
                }
            }
            result[r] = sum;
        }
        return result;
    }

    @Override
    protected void applyColumn(Precomputation data, int var, int delta) {
        var leq = problem.leqColumns[var];
        for (int k = 0; k < leq.rows().length; k++) {
            data.leqSums[leq.rows()[k]] += delta * leq.coefs()[k];
        }
        var eq = problem.eqColumns[var];
        for (int k = 0; k < eq.rows().length; k++) {
            data.eqSums[eq.rows()[k]] += delta * eq.coefs()[k];
        }
    }
}
