package com.github.collomatique.ilp.repr;

import java.util.List;
import java.util.Locale;

import com.github.collomatique.ilp.Constraint;

public enum ReprKind {
    DENSE,
    SPARSE;

    public ProblemRepr create(int variableCount, List<Constraint<Integer>> constraints) {
        return switch (this) {
            case DENSE -> new DenseProblem(variableCount, constraints);
            case SPARSE -> new SparseProblem(variableCount, constraints);
        };
    }

    public static ReprKind parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
