package com.github.collomatique.parser;

public record SemanticWarning(Kind kind, Span span, String message) {

    public enum Kind {
        UNUSED_IDENTIFIER,
        UNUSED_FUNCTION,
        IDENTIFIER_SHADOWED,
        NAMING_CONVENTION,
    }

    @Override
    public String toString() {
        return "warning " + kind + " at " + span + ": " + message;
    }
}
