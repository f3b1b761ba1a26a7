package com.github.collomatique.problem;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.collomatique.eval.TypeSchema;
import com.github.collomatique.parser.CheckedAst;
import com.github.collomatique.parser.Type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Compiled scripts of one host schema, keyed by {@link ScriptRef} and the variables the script
 * sees. Looking up and compiling are separate steps: a miss is for the caller to handle.
 */
@Slf4j
@RequiredArgsConstructor
public class ScriptStore {

    private record Key(ScriptRef ref, Map<String, List<Type>> declaredVars) {}

    @Getter
    @Accessors(fluent = true)
    private final TypeSchema schema;
    private final Map<Key, StoredScript> scripts = new HashMap<>();

    public Optional<StoredScript> lookup(ScriptRef ref, Map<String, List<Type>> declaredVars) {
        return Optional.ofNullable(scripts.get(new Key(ref, Map.copyOf(declaredVars))));
    }

    /**
     * Compiles and stores a script, replacing any previous entry with the same key.
     *
     * @throws com.github.collomatique.parser.CompileException if the script does not compile
     */
    public StoredScript compile(Script script, Map<String, List<Type>> declaredVars) {
        var key = new Key(script.ref(), Map.copyOf(declaredVars));
        log.debug("compiling script {}", key.ref());
        var ast = CheckedAst.compile(script.content(), schema, key.declaredVars());
        var stored = new StoredScript(key.ref(), key.declaredVars(), ast);
        scripts.put(key, stored);
        return stored;
    }

    /** The stored script if any, otherwise compiles it. */
    public StoredScript lookupOrCompile(Script script, Map<String, List<Type>> declaredVars) {
        return lookup(script.ref(), declaredVars).orElseGet(() -> compile(script, declaredVars));
    }

    public int size() {
        return scripts.size();
    }
}
