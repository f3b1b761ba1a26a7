package com.github.collomatique.problem;

/** A named collo-ml source. */
public record Script(String name, String content) {

    public ScriptRef ref() {
        return ScriptRef.of(this);
    }
}
