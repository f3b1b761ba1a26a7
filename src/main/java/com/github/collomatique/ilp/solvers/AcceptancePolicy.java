package com.github.collomatique.ilp.solvers;

/** Probability of moving from a config of cost {@code oldCost} to one of cost {@code newCost}. */
@FunctionalInterface
public interface AcceptancePolicy {

    double acceptance(double oldCost, double newCost, double temperature);

    static AcceptancePolicy metropolis() {
        return (oldCost, newCost, temperature) -> Math.exp(-(newCost - oldCost) / temperature);
    }

    /** Only accepts moves that do not worsen the cost. */
    static AcceptancePolicy greedy() {
        return (oldCost, newCost, temperature) -> newCost <= oldCost ? 1.0 : 0.0;
    }
}
