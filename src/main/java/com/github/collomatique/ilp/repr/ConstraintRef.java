package com.github.collomatique.ilp.repr;

public record ConstraintRef(Block block, int row) {

    public enum Block {
        LEQ,
        EQ,
    }
}
