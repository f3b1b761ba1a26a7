package com.github.collomatique.ilp.repr;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import com.github.collomatique.ilp.Constraint;
import com.github.collomatique.ilp.Sign;

/**
 * Sparse encoding: rows keep only their non-zero entries, and a transposed copy of the
 * same entries gives, for every column, the rows it appears in.
 */
public final class SparseProblem implements ProblemRepr {

    record Row(int[] columns, int[] coefs, int constant) {}

    record Column(int[] rows, int[] coefs) {}

    final int variableCount;
    final Row[] leqRows;
    final Row[] eqRows;
    final Column[] leqColumns;
    final Column[] eqColumns;
    private final ConstraintRef[] refs;

    public SparseProblem(int variableCount, List<Constraint<Integer>> constraints) {
        this.variableCount = variableCount;
        this.refs = new ConstraintRef[constraints.size()];

        List<Row> leq = new ArrayList<>();
        List<Row> eq = new ArrayList<>();
        for (int i = 0; i < constraints.size(); i++) {
            var constraint = constraints.get(i);
            var row = row(constraint);
            if (constraint.getSign() == Sign.LESS_THAN) {
                refs[i] = new ConstraintRef(ConstraintRef.Block.LEQ, leq.size());
                leq.add(row);
            } else {
                refs[i] = new ConstraintRef(ConstraintRef.Block.EQ, eq.size());
                eq.add(row);
            }
        }
        this.leqRows = leq.toArray(Row[]::new);
        this.eqRows = eq.toArray(Row[]::new);
        this.leqColumns = transpose(leqRows, variableCount);
        this.eqColumns = transpose(eqRows, variableCount);
    }

    private static Row row(Constraint<Integer> constraint) {
        var coefficients = constraint.expr().coefficients();
        var columns = new int[coefficients.size()];
        var coefs = new int[coefficients.size()];
        int i = 0;
        for (var entry : coefficients.entrySet()) {
            columns[i] = entry.getKey();
            coefs[i] = entry.getValue();
            i++;
        }
        return new Row(columns, coefs, constraint.getConstant());
    }

    private static Column[] transpose(Row[] rows, int variableCount) {
        var counts = new int[variableCount];
        for (var row : rows) {
            for (int col : row.columns()) {
                counts[col]++;
            }
        }
        var columns = new Column[variableCount];
        for (int col = 0; col < variableCount; col++) {
            columns[col] = new Column(new int[counts[col]], new int[counts[col]]);
        }
        var filled = new int[variableCount];
        for (int r = 0; r < rows.length; r++) {
            var row = rows[r];
            for (int k = 0; k < row.columns().length; k++) {
                int col = row.columns()[k];
                columns[col].rows()[filled[col]] = r;
                columns[col].coefs()[filled[col]] = row.coefs()[k];
                filled[col]++;
            }
        }
        return columns;
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
        return new SparseConfig(this, (BitSet) ones.clone());
    }

    @Override
    public String toString() {
        return "SparseProblem[" + variableCount + " variables, " + leqRows.length + " inequalities, "
                + eqRows.length + " equalities]";
    }
}
