package com.github.collomatique.ilp.solvers;

/** Temperature at annealing step {@code k}, with {@code k >= 1}. */
@FunctionalInterface
public interface TemperatureProfile {

    double temperature(int k);

    static TemperatureProfile inverse(double scale) {
        return k -> scale / k;
    }

    static TemperatureProfile geometric(double initial, double ratio) {
        return k -> initial * Math.pow(ratio, k);
    }

    static TemperatureProfile defaultProfile() {
        return inverse(1_000_000.0);
    }
}
