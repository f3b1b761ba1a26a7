package com.github.collomatique.problem;

import java.util.List;
import java.util.stream.Collectors;

import com.github.collomatique.eval.ExprValue;

/** Variables of an assembled problem. */
public sealed interface ProblemVar<V> {

    /** A variable of the host domain. */
    record Base<V>(V var) implements ProblemVar<V> {
        @Override
        public String toString() {
            return var.toString();
        }
    }

    /** {@code $Name(args)} reified by a script. */
    record Reified<V>(ScriptRef script, String name, List<ExprValue> params) implements ProblemVar<V> {
        @Override
        public String toString() {
            return "$" + name + args(params);
        }
    }

    /** One item of {@code $[Name](args)}. */
    record ReifiedListItem<V>(ScriptRef script, String name, List<ExprValue> params, int index) implements ProblemVar<V> {
        @Override
        public String toString() {
            return "$[" + name + "]" + args(params) + "[" + index + "]";
        }
    }

    /** Indicator of the {@code index}-th inequality in the definition of a reified variable. */
    record Helper<V>(ProblemVar<V> reified, int index) implements ProblemVar<V> {
        @Override
        public String toString() {
            return "%" + reified + "#" + index;
        }
    }

    private static String args(List<ExprValue> params) {
        return params.stream().map(ExprValue::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
