package com.github.collomatique.problem;

import java.util.List;
import java.util.Map;

import com.github.collomatique.parser.CheckedAst;
import com.github.collomatique.parser.Type;

/** A compiled script together with the variables it was checked against. */
public record StoredScript(ScriptRef ref, Map<String, List<Type>> declaredVars, CheckedAst ast) {

    @Override
    public String toString() {
        return "StoredScript[" + ref + "]";
    }
}
