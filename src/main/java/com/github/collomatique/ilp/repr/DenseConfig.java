package com.github.collomatique.ilp.repr;

import java.util.Arrays;
import java.util.BitSet;

final class DenseConfig extends AbstractConfigRepr<DenseProblem> {

    DenseConfig(DenseProblem problem, BitSet values) {
        super(problem, values);
    }

    @Override
    protected ConfigRepr create(BitSet values) {
        return new DenseConfig(problem, values);
    }

    @Override
    public Precomputation precompute() {
        return new Precomputation(problem,
                product(problem.leqMat, problem.leqConstants),
                product(problem.eqMat, problem.eqConstants),
                (BitSet) values.clone());
    }

    // mat * values + constants
    private int[] product(int[][] mat, int[] constants) {
        var result = Arrays.copyOf(constants, constants.length);
        for (int row = 0; row < mat.length; row++) {
            for (int var = values.nextSetBit(0); var >= 0; var = values.nextSetBit(var + 1)) {
                result[row] += mat[row][var];
            }
        }
        return result;
    }

    @Override
    protected void applyColumn(Precomputation data, int var, int delta) {
        for (int row : problem.leqColumns[var]) {
            data.leqSums[row] += delta * problem.leqMat[row][var];
        }
        for (int row : problem.eqColumns[var]) {
            data.eqSums[row] += delta * problem.eqMat[row][var];
        }
    }
}
