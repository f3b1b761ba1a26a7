package com.github.collomatique.ilp;

public enum Sign {
    EQUALS("="),
    LESS_THAN("<=");

    final String symbol;

    private Sign(String symbol) {
        this.symbol = symbol;
    }

    public boolean accepts(int lhs) {
        return switch (this) {
            case EQUALS -> lhs == 0;
            case LESS_THAN -> lhs <= 0;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
