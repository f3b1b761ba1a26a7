package com.github.collomatique.problem;

/** Reads a solution back into host structures. */
@FunctionalInterface
public interface Translator<V, T> {

    T translate(Solution<V> solution);
}
