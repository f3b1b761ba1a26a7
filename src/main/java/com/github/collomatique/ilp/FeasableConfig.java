package com.github.collomatique.ilp;

import java.util.Set;

/**
 * A {@link Config} that satisfied every constraint of its problem when it was checked.
 * Only {@link Config#intoFeasable()} creates instances.
 */
public final class FeasableConfig<V> {

    private final Config<V> config;

    FeasableConfig(Config<V> config) {
        this.config = config;
    }

    public Config<V> inner() {
        return config;
    }

    public Problem<V> problem() {
        return config.problem();
    }

    public boolean get(V var) {
        return config.get(var);
    }

    public Set<V> variablesSetToOne() {
        return config.variablesSetToOne();
    }

    public int objectiveValue() {
        return config.objectiveValue();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FeasableConfig<?> other && config.equals(other.config);
    }

    @Override
    public int hashCode() {
        return config.hashCode();
    }

    @Override
    public String toString() {
        return "Feasable" + config;
    }
}
