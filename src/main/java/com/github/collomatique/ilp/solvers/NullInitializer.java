package com.github.collomatique.ilp.solvers;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.Problem;

public class NullInitializer<V> implements ConfigInitializer<V> {

    @Override
    public Config<V> buildInitConfig(Problem<V> problem) {
        return problem.defaultConfig();
    }
}
