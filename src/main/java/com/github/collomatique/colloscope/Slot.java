package com.github.collomatique.colloscope;

import java.util.Optional;

import com.github.collomatique.eval.EvalObject;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ExprValue.IntValue;
import com.github.collomatique.eval.ObjectEnv;

/** Weekly interrogation slot of a subject. Times are minutes since midnight. */
public record Slot(String id, String subjectId, int weekday, int start, int duration) implements EvalObject {

    public Slot {
        if (weekday < 0 || weekday > 6 || duration <= 0) {
            throw new IllegalArgumentException("invalid slot " + id);
        }
    }

    public int end() {
        return start + duration;
    }

    @Override
    public String typeName() {
        return "Slot";
    }

    @Override
    public Optional<ExprValue> fieldAccess(ObjectEnv env, String field) {
        return switch (field) {
            case "weekday" -> Optional.of(new IntValue(weekday));
            case "start" -> Optional.of(new IntValue(start));
            case "end" -> Optional.of(new IntValue(end()));
            case "subject" -> ColloscopeSchema.object(env, "Subject", o -> ((Subject) o).id().equals(subjectId));
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return id;
    }
}
