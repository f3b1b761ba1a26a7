package com.github.collomatique.ilp.repr;

import java.util.BitSet;

/**
 * A 0/1 assignment encoded against a {@link ProblemRepr}. Instances are immutable; the
 * cached row sums live in a separate {@link Precomputation}.
 */
public interface ConfigRepr {

    ProblemRepr problem();

    boolean get(int var);

    BitSet ones();

    ConfigRepr with(int var, boolean value);

    default ConfigRepr neighbour(int var) {
        return with(var, !get(var));
    }

    /** Full computation of every row sum. */
    Precomputation precompute();

    /** Brings {@code data} up to date with this assignment by applying column deltas. */
    void updatePrecomputation(Precomputation data);

    /** Left-hand side of each constraint, indexed in problem order. */
    int[] computeLhs(Precomputation data);

    boolean isFeasable(Precomputation data);

    /** Sum of the violations: positive parts of inequalities and absolute values of equalities. */
    int maxDistanceToConstraint(Precomputation data);
}
