package com.github.collomatique.eval;

import java.util.List;
import java.util.stream.Collectors;

/** Script function call that produced a constraint. */
public record Origin(String function, List<ExprValue> args) {

    @Override
    public String toString() {
        return function + args.stream().map(ExprValue::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
