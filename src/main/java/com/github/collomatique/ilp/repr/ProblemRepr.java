package com.github.collomatique.ilp.repr;

import java.util.BitSet;

/**
 * Numeric encoding of a problem whose variables have been replaced by their index.
 * Implementations are immutable and may be shared between threads.
 */
public interface ProblemRepr {

    int variableCount();

    int constraintCount();

    /** Where constraint {@code i} (in problem order) lives in the encoding. */
    ConstraintRef constraintRef(int i);

    ConfigRepr configFrom(BitSet ones);

    default ConfigRepr defaultConfig() {
        return configFrom(new BitSet());
    }
}
