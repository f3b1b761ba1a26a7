package com.github.collomatique.ilp.repr;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import com.github.collomatique.ilp.Constraint;
import com.github.collomatique.ilp.Sign;

/**
 * Dense encoding: one {@code int[row][column]} matrix per block, with the constants kept
 * aside. Each column also remembers which rows have a non-zero coefficient so that flipping
 * a variable only visits those rows.
 */
public final class DenseProblem implements ProblemRepr {

    final int variableCount;
    final int[][] leqMat;
    final int[] leqConstants;
    final int[][] eqMat;
    final int[] eqConstants;
    final int[][] leqColumns;
    final int[][] eqColumns;
    private final ConstraintRef[] refs;

    public DenseProblem(int variableCount, List<Constraint<Integer>> constraints) {
        this.variableCount = variableCount;
        this.refs = new ConstraintRef[constraints.size()];

        List<Constraint<Integer>> leq = new ArrayList<>();
        List<Constraint<Integer>> eq = new ArrayList<>();
        for (int i = 0; i < constraints.size(); i++) {
            var constraint = constraints.get(i);
            if (constraint.getSign() == Sign.LESS_THAN) {
                refs[i] = new ConstraintRef(ConstraintRef.Block.LEQ, leq.size());
                leq.add(constraint);
            } else {
                refs[i] = new ConstraintRef(ConstraintRef.Block.EQ, eq.size());
                eq.add(constraint);
            }
        }

        this.leqMat = matrix(leq, variableCount);
        this.leqConstants = constants(leq);
        this.eqMat = matrix(eq, variableCount);
        this.eqConstants = constants(eq);
        this.leqColumns = columns(leqMat, variableCount);
        this.eqColumns = columns(eqMat, variableCount);
    }

    private static int[][] matrix(List<Constraint<Integer>> constraints, int variableCount) {
        var mat = new int[constraints.size()][variableCount];
        for (int row = 0; row < constraints.size(); row++) {
            for (var entry : constraints.get(row).expr().coefficients().entrySet()) {
                mat[row][entry.getKey()] = entry.getValue();
            }
        }
        return mat;
    }

    private static int[] constants(List<Constraint<Integer>> constraints) {
        return constraints.stream().mapToInt(Constraint::getConstant).toArray();
    }

    private static int[][] columns(int[][] mat, int variableCount) {
        var result = new int[variableCount][];
        for (int col = 0; col < variableCount; col++) {
            List<Integer> rows = new ArrayList<>();
            for (int row = 0; row < mat.length; row++) {
                if (mat[row][col] != 0) {
                    rows.add(row);
                }
            }
            result[col] = rows.stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    @Override
    public int variableCount() {
        return variableCount;
    }

    @Override
    public int constraintCount() {
        return refs.length;
    }

    @Override
    public ConstraintRef constraintRef(int i) {
        return refs[i];
    }

    @Override
    public ConfigRepr configFrom(BitSet ones) {
        return new DenseConfig(this, (BitSet) ones.clone());
    }

    @Override
    public String toString() {
        return "DenseProblem[" + variableCount + " variables, " + leqMat.length + " inequalities, "
                + eqMat.length + " equalities]";
    }
}
