package com.github.collomatique.parser;

public record SemanticError(Kind kind, Span span, String message) {

    public enum Kind {
        UNKNOWN_IDENTIFIER,
        UNKNOWN_FUNCTION,
        UNKNOWN_VARIABLE,
        UNKNOWN_TYPE,
        UNKNOWN_FIELD,
        FIELD_ACCESS_ON_NON_OBJECT,
        FUNCTION_ALREADY_DEFINED,
        TYPE_ALREADY_DEFINED,
        VARIABLE_ALREADY_DEFINED,
        PARAMETER_ALREADY_DEFINED,
        ARGUMENT_COUNT_MISMATCH,
        TYPE_MISMATCH,
        BODY_TYPE_MISMATCH,
        NON_LINEAR_PRODUCT,
        NON_EXHAUSTIVE_MATCH,
        UNKNOWN_VARIANT,
        REIFY_TARGET_MISMATCH,
        DOCSTRING_EXPRESSION,
    }

    @Override
    public String toString() {
        return "error " + kind + " at " + span + ": " + message;
    }
}
