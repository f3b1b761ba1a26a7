package com.github.collomatique.parser;

public record Spanned<T>(T value, Span span) {

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
