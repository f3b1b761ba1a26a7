package com.github.collomatique.eval;

import java.util.Optional;

/**
 * A host domain object seen by scripts. The object reports the name of its type in the
 * {@link TypeSchema} and answers field lookups with values of the declared field type.
 */
public interface EvalObject {

    String typeName();

    Optional<ExprValue> fieldAccess(ObjectEnv env, String field);
}
