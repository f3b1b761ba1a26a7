package com.github.collomatique.eval;

import java.util.List;
import java.util.stream.Collectors;

/** Variables appearing in linear expressions produced by scripts. */
public sealed interface IlpVar {

    String name();

    List<ExprValue> params();

    /** {@code $V(args)} for a variable declared by the host. */
    record ExternVar(String name, List<ExprValue> params) implements IlpVar {
        @Override
        public String toString() {
            return "$" + name + args(params);
        }
    }

    /** {@code $R(args)} for a variable reified by the script itself. */
    record ScriptVar(String name, List<ExprValue> params) implements IlpVar {
        @Override
        public String toString() {
            return "$" + name + args(params);
        }
    }

    /** One item of {@code $[L](args)}. */
    record ScriptVarListItem(String name, List<ExprValue> params, int index) implements IlpVar {
        @Override
        public String toString() {
            return "$[" + name + "]" + args(params) + "[" + index + "]";
        }
    }

    private static String args(List<ExprValue> params) {
        return params.stream().map(ExprValue::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
