package com.github.collomatique.ilp;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised while assembling a problem: duplicate declarations, references to undeclared
 * variables or variable bindings the domain cannot satisfy.
 */
public class ModelException extends RuntimeException {

    public enum Kind {
        VARIABLE_ALREADY_DECLARED,
        UNDECLARED_VARIABLE,
        INVALID_VARIABLE,
        UNKNOWN_DOMAIN_VARIABLE,
        SCHEMA_MISMATCH,
        REIFICATION_ALREADY_DECLARED,
        UNKNOWN_FUNCTION,
    }

    @Getter
    @Accessors(fluent = true)
    private final Kind kind;

    public ModelException(Kind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public static ModelException alreadyDeclared(Object var) {
        return new ModelException(Kind.VARIABLE_ALREADY_DECLARED, "variable " + var + " is already declared");
    }

    public static ModelException undeclared(Object var) {
        return new ModelException(Kind.UNDECLARED_VARIABLE, "variable " + var + " is not declared");
    }

    public static ModelException invalid(Object var) {
        return new ModelException(Kind.INVALID_VARIABLE, "variable " + var + " does not belong to the problem");
    }
}
