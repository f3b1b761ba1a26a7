package com.github.collomatique.colloscope;

import java.util.Optional;

import com.github.collomatique.eval.EvalObject;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ExprValue.IntValue;
import com.github.collomatique.eval.ExprValue.StringValue;
import com.github.collomatique.eval.ObjectEnv;

/**
 * A subject with interrogations in groups. Groups are numbered from 1 to {@code groupCount}
 * and hold between {@code minStudents} and {@code maxStudents} students when used.
 */
public record Subject(String id, String name, int groupCount, int minStudents, int maxStudents) implements EvalObject {

    public Subject {
        if (groupCount < 0 || minStudents < 0 || maxStudents < minStudents) {
            throw new IllegalArgumentException("invalid group settings for subject " + id);
        }
    }

    @Override
    public String typeName() {
        return "Subject";
    }

    @Override
    public Optional<ExprValue> fieldAccess(ObjectEnv env, String field) {
        return switch (field) {
            case "name" -> Optional.of(new StringValue(name));
            case "min_students" -> Optional.of(new IntValue(minStudents));
            case "max_students" -> Optional.of(new IntValue(maxStudents));
            case "groups" -> Optional.of(ColloscopeSchema.objectList(env, "Group", o -> ((Group) o).subjectId().equals(id)));
            case "slots" -> Optional.of(ColloscopeSchema.objectList(env, "Slot", o -> ((Slot) o).subjectId().equals(id)));
            case "students" -> Optional.of(ColloscopeSchema.objectList(env, "Student", o -> ((Student) o).subjectIds().contains(id)));
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return id;
    }
}
