package com.github.collomatique.parser;

/** A script could not be compiled. */
public abstract class CompileException extends RuntimeException {

    protected CompileException(String message) {
        super(message);
    }
}
