package com.github.collomatique.eval;

import java.util.List;

/** Snapshot of the domain objects a script is evaluated against. */
public interface ObjectEnv {

    ObjectEnv EMPTY = typeName -> List.of();

    /** All objects of the given schema type, in a stable order. */
    List<? extends EvalObject> objectsWithType(String typeName);
}
