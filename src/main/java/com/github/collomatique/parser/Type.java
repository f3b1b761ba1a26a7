package com.github.collomatique.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.stream.Collectors;

/**
 * Static types of collo-ml expressions. Custom, enum and object types are nominal; their
 * definitions live in the {@link TypeRegistry} of the compiled script or in the host schema.
 */
public sealed interface Type {

    enum Primitive implements Type {
        INT("Int"),
        BOOL("Bool"),
        STRING("String"),
        LIN_EXPR("LinExpr"),
        CONSTRAINT("Constraint");

        private final String displayName;

        Primitive(String displayName) {
            this.displayName = displayName;
        }

        public static Optional<Primitive> byName(String name) {
            for (var primitive : values()) {
                if (primitive.displayName.equals(name)) {
                    return Optional.of(primitive);
                }
            }
            return Optional.empty();
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    Type INT = Primitive.INT;
    Type BOOL = Primitive.BOOL;
    Type STRING = Primitive.STRING;
    Type LIN_EXPR = Primitive.LIN_EXPR;
    Type CONSTRAINT = Primitive.CONSTRAINT;

    /** Type of {@code []} before it meets a context. */
    record EmptyList() implements Type {
        @Override
        public String toString() {
            return "[]";
        }
    }

    record ListType(Type element) implements Type {
        @Override
        public String toString() {
            return "[" + element + "]";
        }
    }

    record TupleType(List<Type> elements) implements Type {
        @Override
        public String toString() {
            return elements.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    record StructType(SortedMap<String, Type> fields) implements Type {
        @Override
        public String toString() {
            return fields.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining(", ", "{", "}"));
        }
    }

    record ObjectType(String name) implements Type {
        @Override
        public String toString() {
            return name;
        }
    }

    record CustomType(String name) implements Type {
        @Override
        public String toString() {
            return name;
        }
    }

    record EnumType(String name) implements Type {
        @Override
        public String toString() {
            return name;
        }
    }

    record VariantType(String enumName, String variant) implements Type {
        public EnumType enumType() {
            return new EnumType(enumName);
        }

        @Override
        public String toString() {
            return enumName + "::" + variant;
        }
    }

    /** Placeholder after a reported error; never survives a successful check. */
    record Unknown() implements Type {
        @Override
        public String toString() {
            return "?";
        }
    }

    static Type listOf(Type element) {
        return new ListType(element);
    }

    static boolean isList(Type type) {
        return type instanceof ListType || type instanceof EmptyList;
    }

    static boolean isNumeric(Type type) {
        return type == INT || type == LIN_EXPR;
    }

    /** Whether a value of type {@code from} can be used where {@code to} is expected. */
    static boolean canCoerce(Type from, Type to) {
        if (from.equals(to) || from instanceof Unknown || to instanceof Unknown) {
            return true;
        }
        if (from == INT && to == LIN_EXPR) {
            return true;
        }
        if (from instanceof EmptyList) {
            return to instanceof ListType;
        }
        if (from instanceof ListType f && to instanceof ListType t) {
            return canCoerce(f.element(), t.element());
        }
        if (from instanceof VariantType v && to instanceof EnumType e) {
            return v.enumName().equals(e.name());
        }
        if (from instanceof TupleType f && to instanceof TupleType t) {
            if (f.elements().size() != t.elements().size()) {
                return false;
            }
            for (int i = 0; i < f.elements().size(); i++) {
                if (!canCoerce(f.elements().get(i), t.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (from instanceof StructType f && to instanceof StructType t) {
            if (!f.fields().keySet().equals(t.fields().keySet())) {
                return false;
            }
            for (var entry : f.fields().entrySet()) {
                if (!canCoerce(entry.getValue(), t.fields().get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /** Smallest type both {@code a} and {@code b} coerce to, if any. */
    static Optional<Type> unify(Type a, Type b) {
        if (canCoerce(a, b)) {
            return Optional.of(b instanceof Unknown ? a : b);
        }
        if (canCoerce(b, a)) {
            return Optional.of(a);
        }
        if (a instanceof VariantType va && b instanceof VariantType vb && va.enumName().equals(vb.enumName())) {
            return Optional.of(va.enumType());
        }
        if (a instanceof ListType la && b instanceof ListType lb) {
            return unify(la.element(), lb.element()).map(Type::listOf);
        }
        if (a instanceof TupleType ta && b instanceof TupleType tb && ta.elements().size() == tb.elements().size()) {
            List<Type> elements = new ArrayList<>();
            for (int i = 0; i < ta.elements().size(); i++) {
                var unified = unify(ta.elements().get(i), tb.elements().get(i));
                if (unified.isEmpty()) {
                    return Optional.empty();
                }
                elements.add(unified.get());
            }
            return Optional.of(new TupleType(elements));
        }
        return Optional.empty();
    }
}
