package com.github.collomatique.problem;

public enum ObjectiveSense {
    MINIMIZE,
    MAXIMIZE;

    int sign() {
        return this == MINIMIZE ? 1 : -1;
    }
}
