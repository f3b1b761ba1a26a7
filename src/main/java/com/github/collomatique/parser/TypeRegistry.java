package com.github.collomatique.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.github.collomatique.eval.TypeSchema;

/** Named types visible to a script: host object types plus the script's own custom types and enums. */
public class TypeRegistry {

    private final TypeSchema schema;
    private final Map<String, Type> customTypes = new LinkedHashMap<>();
    // enum -> variant -> payload type, empty for unit variants
    private final Map<String, Map<String, Optional<Type>>> enums = new LinkedHashMap<>();

    public TypeRegistry(TypeSchema schema) {
        this.schema = schema;
    }

    public TypeSchema schema() {
        return schema;
    }

    /** Whether {@code name} already denotes a type. */
    public boolean isDefined(String name) {
        return Type.Primitive.byName(name).isPresent()
                || schema.hasType(name)
                || customTypes.containsKey(name)
                || enums.containsKey(name);
    }

    void declareCustom(String name) {
        customTypes.put(name, new Type.Unknown());
    }

    void defineCustom(String name, Type underlying) {
        customTypes.put(name, underlying);
    }

    void declareEnum(String name) {
        enums.put(name, new LinkedHashMap<>());
    }

    void defineVariant(String enumName, String variant, Optional<Type> payload) {
        enums.get(enumName).put(variant, payload);
    }

    public Optional<Type> lookup(String name) {
        var primitive = Type.Primitive.byName(name);
        if (primitive.isPresent()) {
            return Optional.of(primitive.get());
        }
        if (schema.hasType(name)) {
            return Optional.of(new Type.ObjectType(name));
        }
        if (customTypes.containsKey(name)) {
            return Optional.of(new Type.CustomType(name));
        }
        if (enums.containsKey(name)) {
            return Optional.of(new Type.EnumType(name));
        }
        return Optional.empty();
    }

    public boolean isCustom(String name) {
        return customTypes.containsKey(name);
    }

    public boolean isEnum(String name) {
        return enums.containsKey(name);
    }

    public Type underlying(String customName) {
        return customTypes.get(customName);
    }

    public Map<String, Optional<Type>> variants(String enumName) {
        return Collections.unmodifiableMap(enums.getOrDefault(enumName, Map.of()));
    }

    public boolean hasVariant(String enumName, String variant) {
        return enums.containsKey(enumName) && enums.get(enumName).containsKey(variant);
    }

    public Optional<Type> payload(String enumName, String variant) {
        return enums.get(enumName).get(variant);
    }

    /** Type of {@code field} on values of {@code type}, looking through variant payloads. */
    public Optional<Type> fieldType(Type type, String field) {
        if (type instanceof Type.ObjectType o) {
            return schema.fieldType(o.name(), field);
        }
        if (type instanceof Type.StructType s) {
            return Optional.ofNullable(s.fields().get(field));
        }
        if (type instanceof Type.TupleType t) {
            try {
                int index = Integer.parseInt(field);
                return index >= 0 && index < t.elements().size() ? Optional.of(t.elements().get(index)) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (type instanceof Type.VariantType v && hasVariant(v.enumName(), v.variant())) {
            return payload(v.enumName(), v.variant()).flatMap(p -> fieldType(p, field));
        }
        return Optional.empty();
    }

    /** Whether {@code type} has fields at all. */
    public boolean hasFields(Type type) {
        return type instanceof Type.ObjectType
                || type instanceof Type.StructType
                || type instanceof Type.TupleType
                || (type instanceof Type.VariantType v && hasVariant(v.enumName(), v.variant())
                        && payload(v.enumName(), v.variant()).map(this::hasFields).orElse(false));
    }
}
