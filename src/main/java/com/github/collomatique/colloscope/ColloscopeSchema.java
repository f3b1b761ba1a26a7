package com.github.collomatique.colloscope;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import com.github.collomatique.eval.EvalObject;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ExprValue.ListValue;
import com.github.collomatique.eval.ExprValue.ObjectValue;
import com.github.collomatique.eval.ObjectEnv;
import com.github.collomatique.eval.TypeSchema;
import com.github.collomatique.parser.Type;

/** Object types of the colloscope domain as scripts see them. */
public final class ColloscopeSchema {

    public static final Type STUDENT = new Type.ObjectType("Student");
    public static final Type SUBJECT = new Type.ObjectType("Subject");
    public static final Type GROUP = new Type.ObjectType("Group");
    public static final Type SLOT = new Type.ObjectType("Slot");
    public static final Type WEEK = new Type.ObjectType("Week");

    public static final TypeSchema SCHEMA = TypeSchema.builder()
            .field("Student", "name", Type.STRING)
            .field("Student", "subjects", Type.listOf(SUBJECT))
            .field("Subject", "name", Type.STRING)
            .field("Subject", "min_students", Type.INT)
            .field("Subject", "max_students", Type.INT)
            .field("Subject", "groups", Type.listOf(GROUP))
            .field("Subject", "slots", Type.listOf(SLOT))
            .field("Subject", "students", Type.listOf(STUDENT))
            .field("Group", "subject", SUBJECT)
            .field("Group", "number", Type.INT)
            .field("Slot", "subject", SUBJECT)
            .field("Slot", "weekday", Type.INT)
            .field("Slot", "start", Type.INT)
            .field("Slot", "end", Type.INT)
            .field("Week", "number", Type.INT)
            .build();

    private ColloscopeSchema() {}

    static ListValue objectList(ObjectEnv env, String typeName, Predicate<EvalObject> filter) {
        Set<ExprValue> elements = new LinkedHashSet<>();
        for (var object : env.objectsWithType(typeName)) {
            if (filter.test(object)) {
                elements.add(new ObjectValue(object));
            }
        }
        return new ListValue(new Type.ObjectType(typeName), elements);
    }

    static Optional<ExprValue> object(ObjectEnv env, String typeName, Predicate<EvalObject> filter) {
        return env.objectsWithType(typeName).stream()
                .filter(filter)
                .findFirst()
                .map(ObjectValue::new);
    }
}
