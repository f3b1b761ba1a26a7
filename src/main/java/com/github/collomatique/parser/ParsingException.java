package com.github.collomatique.parser;

import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
public class ParsingException extends CompileException {

    public enum Kind {
        UNEXPECTED_CHARACTER,
        UNTERMINATED_STRING,
        UNEXPECTED_TOKEN,
        MISSING_NAME,
        MISSING_TYPE,
        MISSING_BODY,
        MISSING_EXPRESSION,
        MALFORMED_INTEGER,
        UNMATCHED_BACKTICK,
        DOCSTRING_EXPRESSION,
    }

    private final Kind kind;
    private final Span span;

    public ParsingException(Kind kind, Span span, String message) {
        super(kind + " at " + span + ": " + message);
        this.kind = kind;
        this.span = span;
    }
}
