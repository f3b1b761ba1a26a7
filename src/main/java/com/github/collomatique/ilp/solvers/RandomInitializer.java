package com.github.collomatique.ilp.solvers;

import java.util.ArrayList;
import java.util.Random;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.Problem;

import lombok.Getter;
import lombok.experimental.Accessors;

/** Sets each variable to one independently with probability {@code p}. */
public class RandomInitializer<V> implements ConfigInitializer<V> {

    @Getter
    @Accessors(fluent = true)
    private final double p;
    private final Random random;

    public RandomInitializer(double p, Random random) {
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException("probability must be in [0, 1], got " + p);
        }
        this.p = p;
        this.random = random;
    }

    @Override
    public Config<V> buildInitConfig(Problem<V> problem) {
        var ones = new ArrayList<V>();
        for (var var : problem.variables()) {
            if (random.nextDouble() < p) {
                ones.add(var);
            }
        }
        return problem.configFrom(ones);
    }
}
