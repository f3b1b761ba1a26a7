package com.github.collomatique.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.collomatique.parser.Type;

/** Host object types and their typed fields, as seen by scripts through {@code @[Type]} and {@code x.field}. */
public class TypeSchema {

    private static final TypeSchema EMPTY = new TypeSchema(Map.of());

    private final Map<String, Map<String, Type>> types;

    private TypeSchema(Map<String, Map<String, Type>> types) {
        this.types = types;
    }

    public static TypeSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasType(String typeName) {
        return types.containsKey(typeName);
    }

    public Set<String> typeNames() {
        return types.keySet();
    }

    public Map<String, Type> fields(String typeName) {
        return types.getOrDefault(typeName, Map.of());
    }

    public Optional<Type> fieldType(String typeName, String field) {
        return Optional.ofNullable(fields(typeName).get(field));
    }

    public static class Builder {
        private final Map<String, Map<String, Type>> types = new LinkedHashMap<>();

        public Builder type(String typeName) {
            types.computeIfAbsent(typeName, k -> new LinkedHashMap<>());
            return this;
        }

        public Builder field(String typeName, String field, Type type) {
            type(typeName);
            types.get(typeName).put(field, type);
            return this;
        }

        public TypeSchema build() {
            Map<String, Map<String, Type>> copy = new LinkedHashMap<>();
            types.forEach((name, fields) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
            for (var fields : copy.values()) {
                for (var fieldType : fields.values()) {
                    checkResolved(fieldType, copy);
                }
            }
            return new TypeSchema(Collections.unmodifiableMap(copy));
        }

        private static void checkResolved(Type type, Map<String, Map<String, Type>> types) {
            if (type instanceof Type.ObjectType o && !types.containsKey(o.name())) {
                throw new IllegalArgumentException("schema field refers to unknown object type " + o.name());
            }
            if (type instanceof Type.ListType l) {
                checkResolved(l.element(), types);
            }
            if (type instanceof Type.TupleType t) {
                t.elements().forEach(e -> checkResolved(e, types));
            }
            if (type instanceof Type.StructType s) {
                s.fields().values().forEach(e -> checkResolved(e, types));
            }
            if (type instanceof Type.CustomType || type instanceof Type.EnumType || type instanceof Type.VariantType) {
                throw new IllegalArgumentException("schema fields cannot use script-defined type " + type);
            }
        }
    }
}
