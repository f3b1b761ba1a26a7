package com.github.collomatique.eval;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.parser.Type;

/** Runtime values. All of them are immutable; lists are sets tagged with their element type. */
public sealed interface ExprValue {

    record IntValue(int value) implements ExprValue {
        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    record BoolValue(boolean value) implements ExprValue {
        public static final BoolValue TRUE = new BoolValue(true);
        public static final BoolValue FALSE = new BoolValue(false);

        public static BoolValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record StringValue(String value) implements ExprValue {
        @Override
        public String toString() {
            return value;
        }
    }

    record LinExprValue(LinExpr<IlpVar> expr) implements ExprValue {
        @Override
        public String toString() {
            return expr.toString();
        }
    }

    /** A conjunction of constraints. */
    record ConstraintValue(List<ConstraintWithOrigin> constraints) implements ExprValue {
        public ConstraintValue {
            constraints = List.copyOf(constraints);
        }

        @Override
        public String toString() {
            return constraints.stream()
                    .map(c -> c.constraint().toString())
                    .collect(Collectors.joining(" and "));
        }
    }

    record ListValue(Type elementType, Set<ExprValue> elements) implements ExprValue {
        public ListValue {
            elements = Collections.unmodifiableSet(new LinkedHashSet<>(elements));
        }

        public static ListValue of(Type elementType, ExprValue... elements) {
            return new ListValue(elementType, new LinkedHashSet<>(List.of(elements)));
        }

        @Override
        public String toString() {
            return elements.stream().map(ExprValue::toString).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    record TupleValue(List<ExprValue> elements) implements ExprValue {
        public TupleValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String toString() {
            return elements.stream().map(ExprValue::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    record StructValue(SortedMap<String, ExprValue> fields) implements ExprValue {
        public StructValue {
            fields = Collections.unmodifiableSortedMap(new TreeMap<>(fields));
        }

        @Override
        public String toString() {
            return fields.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining(", ", "{", "}"));
        }
    }

    record CustomValue(String typeName, ExprValue inner) implements ExprValue {
        @Override
        public String toString() {
            return typeName + "(" + inner + ")";
        }
    }

    record EnumValue(String enumName, String variant, Optional<ExprValue> payload) implements ExprValue {
        @Override
        public String toString() {
            var name = enumName + "::" + variant;
            if (payload.isEmpty()) {
                return name;
            }
            var inner = payload.get();
            if (inner instanceof TupleValue || inner instanceof StructValue) {
                return name + inner;
            }
            return name + "(" + inner + ")";
        }
    }

    record ObjectValue(EvalObject object) implements ExprValue {
        @Override
        public String toString() {
            return object.toString();
        }
    }
}
