package com.github.collomatique.parser;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.experimental.Accessors;

/** All semantic errors of one compile pass, with the warnings found along the way. */
@Getter
@Accessors(fluent = true)
public class SemanticException extends CompileException {

    private final List<SemanticError> errors;
    private final List<SemanticWarning> warnings;

    public SemanticException(List<SemanticError> errors, List<SemanticWarning> warnings) {
        super(errors.size() + " semantic error(s):\n" + errors.stream()
                .map(SemanticError::toString)
                .collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }
}
