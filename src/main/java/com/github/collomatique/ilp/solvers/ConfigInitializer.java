package com.github.collomatique.ilp.solvers;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.Problem;

/** Produces the starting point of a feasibility search. */
public interface ConfigInitializer<V> {

    Config<V> buildInitConfig(Problem<V> problem);
}
