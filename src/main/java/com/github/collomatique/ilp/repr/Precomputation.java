package com.github.collomatique.ilp.repr;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Cached left-hand sides of every row, split like the matrix blocks, together with the
 * assignment they were computed for. Updating it to another assignment of the same problem
 * only touches the columns that differ.
 */
public final class Precomputation {

    final ProblemRepr owner;
    final int[] leqSums;
    final int[] eqSums;
    final BitSet snapshot;

    Precomputation(ProblemRepr owner, int[] leqSums, int[] eqSums, BitSet snapshot) {
        this.owner = owner;
        this.leqSums = leqSums;
        this.eqSums = eqSums;
        this.snapshot = snapshot;
    }

    public Precomputation copy() {
        return new Precomputation(owner,
                Arrays.copyOf(leqSums, leqSums.length),
                Arrays.copyOf(eqSums, eqSums.length),
                (BitSet) snapshot.clone());
    }

    public int lhs(ConstraintRef ref) {
        return switch (ref.block()) {
            case LEQ -> leqSums[ref.row()];
            case EQ -> eqSums[ref.row()];
        };
    }

    /** Columns whose value differs between the snapshot and {@code values}. */
    BitSet changedColumns(BitSet values) {
        var changed = (BitSet) snapshot.clone();
        changed.xor(values);
        return changed;
    }

    void checkOwner(ProblemRepr problem) {
        if (owner != problem) {
            throw new IllegalStateException("precomputation was built for another problem representation");
        }
    }
}
