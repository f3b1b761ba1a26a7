package com.github.collomatique.parser;

/** Byte range {@code [start, end)} in a script source. */
public record Span(int start, int end) {

    public static final Span NONE = new Span(0, 0);

    public Span merge(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    /** 1-based line of {@code start} in {@code source}. */
    public int line(String source) {
        int line = 1;
        for (int i = 0; i < Math.min(start, source.length()); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
