package com.github.collomatique.problem;

import java.util.List;
import java.util.stream.Collectors;

import com.github.collomatique.eval.ExprValue;

/** A call of a public script function. */
public record FnCall(String name, List<ExprValue> args) {

    public static FnCall of(String name, ExprValue... args) {
        return new FnCall(name, List.of(args));
    }

    @Override
    public String toString() {
        return name + args.stream().map(ExprValue::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
