package com.github.collomatique.colloscope;

import java.util.Optional;

import com.github.collomatique.eval.EvalObject;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ExprValue.IntValue;
import com.github.collomatique.eval.ObjectEnv;

public record Group(String subjectId, int number) implements EvalObject {

    @Override
    public String typeName() {
        return "Group";
    }

    @Override
    public Optional<ExprValue> fieldAccess(ObjectEnv env, String field) {
        return switch (field) {
            case "number" -> Optional.of(new IntValue(number));
            case "subject" -> ColloscopeSchema.object(env, "Subject", o -> ((Subject) o).id().equals(subjectId));
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return subjectId + "#" + number;
    }
}
