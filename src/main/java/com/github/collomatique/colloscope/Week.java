package com.github.collomatique.colloscope;

import java.util.Optional;

import com.github.collomatique.eval.EvalObject;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ExprValue.IntValue;
import com.github.collomatique.eval.ObjectEnv;

public record Week(int number) implements EvalObject {

    @Override
    public String typeName() {
        return "Week";
    }

    @Override
    public Optional<ExprValue> fieldAccess(ObjectEnv env, String field) {
        if (field.equals("number")) {
            return Optional.of(new IntValue(number));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "W" + number;
    }
}
