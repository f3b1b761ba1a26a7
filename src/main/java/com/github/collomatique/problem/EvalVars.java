package com.github.collomatique.problem;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.collomatique.eval.IlpVar.ExternVar;
import com.github.collomatique.eval.ObjectEnv;
import com.github.collomatique.parser.Type;

/**
 * The boolean variables a host domain exposes to scripts as {@code $Name(args)}.
 *
 * @param <V> the host's variable type
 */
public interface EvalVars<V> {

    /** Parameter types of every variable family, by name. */
    Map<String, List<Type>> fieldSchema();

    /** The free variables for the given domain snapshot, in a stable order. */
    Set<V> vars(ObjectEnv env);

    /** Decodes a script variable; empty when the arguments name no variable of the domain. */
    Optional<V> fromExtern(ExternVar var);

    /** A fixed value for variables that are not free. */
    default Optional<Boolean> fix(V var) {
        return Optional.empty();
    }
}
