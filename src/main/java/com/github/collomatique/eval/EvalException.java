package com.github.collomatique.eval;

import com.github.collomatique.parser.Span;

import lombok.Getter;
import lombok.experimental.Accessors;

/** Evaluation of a checked script failed. The compiled script stays usable. */
@Getter
@Accessors(fluent = true)
public class EvalException extends RuntimeException {

    public enum Kind {
        DIVISION_BY_ZERO,
        OVERFLOW,
        MISSING_FIELD,
        INVALID_OBJECT,
        UNKNOWN_FUNCTION,
        ARGUMENT_MISMATCH,
        RECURSION_LIMIT,
    }

    private final Kind kind;
    private final Span span;

    public EvalException(Kind kind, Span span, String message) {
        super(kind + " at " + span + ": " + message);
        this.kind = kind;
        this.span = span;
    }
}
