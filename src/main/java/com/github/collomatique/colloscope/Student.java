package com.github.collomatique.colloscope;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.collomatique.eval.EvalObject;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ExprValue.StringValue;
import com.github.collomatique.eval.ObjectEnv;

/**
 * A student following some subjects. {@code fixedGroups} maps a subject id to the number of
 * the group the student is already placed in.
 */
public record Student(String id, String name, Set<String> subjectIds, Map<String, Integer> fixedGroups) implements EvalObject {

    public Student {
        subjectIds = Set.copyOf(subjectIds);
        fixedGroups = Map.copyOf(fixedGroups);
        if (!subjectIds.containsAll(fixedGroups.keySet())) {
            throw new IllegalArgumentException("student " + id + " is placed in a group of a subject they do not follow");
        }
    }

    public Student(String id, String name, Set<String> subjectIds) {
        this(id, name, subjectIds, Map.of());
    }

    @Override
    public String typeName() {
        return "Student";
    }

    @Override
    public Optional<ExprValue> fieldAccess(ObjectEnv env, String field) {
        return switch (field) {
            case "name" -> Optional.of(new StringValue(name));
            case "subjects" -> Optional.of(ColloscopeSchema.objectList(env, "Subject", o -> subjectIds.contains(((Subject) o).id())));
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return id;
    }
}
