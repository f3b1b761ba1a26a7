package com.github.collomatique.parser;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

import com.github.collomatique.Tokenizer.TokenType;

/** Checked script: every name is resolved and every expression carries its type. */
public record TCompilationUnit(
        Map<String, TFunction> functions,
        List<TReification> reifications,
        TypeRegistry types) {

    public record TParam(String name, Type type) {}

    public record TFunction(
            String name,
            boolean pub,
            List<TParam> params,
            Type returnType,
            TExpression body,
            List<TDocLine> docstring,
            Span span) {

        public List<Type> paramTypes() {
            return params.stream().map(TParam::type).toList();
        }
    }

    public record TReification(String function, String varName, boolean list, List<Type> paramTypes, List<TDocLine> docstring, Span span) {}

    public record TDocLine(List<TDocPart> parts) {}
    public sealed interface TDocPart {}
    public record TDocText(String text) implements TDocPart {}
    public record TDocExpression(TExpression expression) implements TDocPart {}

    public sealed interface TExpression {
        Type type();
        Span span();
    }

    public record TIntExpression(int value, Span span) implements TExpression {
        public Type type() { return Type.INT; }
    }
    public record TBoolExpression(boolean value, Span span) implements TExpression {
        public Type type() { return Type.BOOL; }
    }
    public record TStringExpression(String value, Span span) implements TExpression {
        public Type type() { return Type.STRING; }
    }

    /** Parameter, let binding, loop variable or match binding. */
    public record TLocalExpression(String name, Type type, Span span) implements TExpression {}

    public record TCallExpression(String function, List<TExpression> arguments, Type type, Span span) implements TExpression {}

    /** {@code $V(args)}; {@code script} when the variable is reified in the same script. */
    public record TVarCallExpression(String name, boolean list, boolean script, List<TExpression> arguments, Type type, Span span) implements TExpression {}

    public record TGlobalListExpression(String typeName, Type type, Span span) implements TExpression {}

    public record TListExpression(List<TExpression> elements, Type type, Span span) implements TExpression {}
    public record TRangeExpression(TExpression start, TExpression end, Span span) implements TExpression {
        public Type type() { return Type.listOf(Type.INT); }
    }
    public record TComprehensionExpression(TExpression body, List<TBinding> bindings, Optional<TExpression> filter, Type type, Span span) implements TExpression {}
    public record TBinding(String name, TExpression collection) {}
    public record TCardinalityExpression(TExpression collection, Span span) implements TExpression {
        public Type type() { return Type.INT; }
    }

    public record TTupleExpression(List<TExpression> elements, Type type, Span span) implements TExpression {}
    public record TStructExpression(SortedMap<String, TExpression> fields, Type type, Span span) implements TExpression {}
    public record TFieldExpression(TExpression target, String field, Type type, Span span) implements TExpression {}
    public record TTupleIndexExpression(TExpression target, int index, Type type, Span span) implements TExpression {}

    /** Implicit or {@code as} coercion of {@code expression} to {@code type}. */
    public record TCoerceExpression(TExpression expression, Type type, Span span) implements TExpression {}

    public enum Conversion { TO_STRING, TO_LIN_EXPR }
    public record TConvertExpression(Conversion conversion, TExpression expression, Type type, Span span) implements TExpression {}

    public record TCustomExpression(String typeName, TExpression value, Type type, Span span) implements TExpression {}

    /** Payload of a custom value or single-payload variant. */
    public record TUnwrapExpression(TExpression value, Type type, Span span) implements TExpression {}

    public record TVariantExpression(String enumName, String variant, Optional<TExpression> payload, Type type, Span span) implements TExpression {}

    public record TUnaryExpression(TokenType operator, TExpression operand, Type type, Span span) implements TExpression {}
    public record TBinaryExpression(TExpression left, TokenType operator, TExpression right, Type type, Span span) implements TExpression {}

    public record TIfExpression(TExpression condition, TExpression thenBranch, TExpression elseBranch, Type type, Span span) implements TExpression {}
    public record TLetExpression(String name, TExpression value, TExpression body, Type type, Span span) implements TExpression {}

    public record TMatchExpression(TExpression scrutinee, List<TMatchBranch> branches, Type type, Span span) implements TExpression {}
    /** A branch matches when the value has {@code test} (if any) and {@code filter} holds. */
    public record TMatchBranch(Optional<String> binding, Optional<Type> test, Optional<TExpression> filter, TExpression body) {}

    public record TForallExpression(String var, TExpression collection, Optional<TExpression> filter, TExpression body, Type type, Span span) implements TExpression {}
    public record TSumExpression(String var, TExpression collection, Optional<TExpression> filter, TExpression body, Type type, Span span) implements TExpression {}
    public record TFoldExpression(
            String var,
            TExpression collection,
            String accumulator,
            TExpression init,
            Optional<TExpression> filter,
            TExpression body,
            Type type,
            Span span) implements TExpression {}
}
