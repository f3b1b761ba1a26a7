package com.github.collomatique.parser;

import java.util.List;
import java.util.Optional;

import com.github.collomatique.Tokenizer.TokenType;

public record CompilationUnit(List<Statement> statements) {

    public sealed interface Statement {
        Span span();
    }

    public record Param(Spanned<String> name, TypeName type) {}

    public record LetStatement(
            boolean pub,
            Spanned<String> name,
            List<Param> params,
            TypeName returnType,
            Expression body,
            List<DocLine> docstring,
            Span span) implements Statement {}

    public record ReifyStatement(
            Spanned<String> function,
            Spanned<String> varName,
            boolean list,
            List<DocLine> docstring,
            Span span) implements Statement {}

    public record TypeStatement(Spanned<String> name, TypeName underlying, Span span) implements Statement {}

    public record EnumStatement(Spanned<String> name, List<VariantDecl> variants, Span span) implements Statement {}

    public record VariantDecl(Spanned<String> name, VariantShape shape) {}

    public sealed interface VariantShape {}
    public record UnitShape() implements VariantShape {}
    public record TupleShape(List<TypeName> elements) implements VariantShape {}
    public record StructShape(List<FieldDecl> fields) implements VariantShape {}

    public record FieldDecl(Spanned<String> name, TypeName type) {}

    // types as written in the source

    public sealed interface TypeName {
        Span span();
    }
    public record SimpleTypeName(String name, Span span) implements TypeName {}
    public record VariantTypeName(String enumName, String variant, Span span) implements TypeName {}
    public record ListTypeName(TypeName element, Span span) implements TypeName {}
    public record TupleTypeName(List<TypeName> elements, Span span) implements TypeName {}
    public record StructTypeName(List<FieldDecl> fields, Span span) implements TypeName {}

    // docstrings

    public record DocLine(List<DocPart> parts, Span span) {}

    public sealed interface DocPart {}
    public record DocText(String text) implements DocPart {}
    public record DocExpression(Expression expression) implements DocPart {}
    public record DocError(ParsingException error) implements DocPart {}

    // expressions

    public sealed interface Expression {
        Span span();
    }

    public record IntExpression(int value, Span span) implements Expression {}
    public record BoolExpression(boolean value, Span span) implements Expression {}
    public record StringExpression(String value, Span span) implements Expression {}
    public record IdentExpression(String name, Span span) implements Expression {}

    /** {@code f(args)}; also conversions {@code Int(x)} and custom type constructions {@code Name(x)}. */
    public record CallExpression(Spanned<String> name, List<Expression> arguments, Span span) implements Expression {}

    /** {@code E::V}, {@code E::V(args)}. */
    public record VariantExpression(Spanned<String> enumName, Spanned<String> variant, Optional<List<Expression>> arguments, Span span) implements Expression {}
    public record VariantStructExpression(Spanned<String> enumName, Spanned<String> variant, List<FieldInit> fields, Span span) implements Expression {}

    /** {@code $V(args)} or {@code $[V](args)}. */
    public record VarCallExpression(Spanned<String> name, boolean list, List<Expression> arguments, Span span) implements Expression {}

    /** {@code @[Type]}. */
    public record GlobalListExpression(Spanned<String> typeName, Span span) implements Expression {}

    public record ListExpression(List<Expression> elements, Span span) implements Expression {}
    public record RangeExpression(Expression start, Expression end, Span span) implements Expression {}
    public record ComprehensionExpression(Expression body, List<Binding> bindings, Optional<Expression> filter, Span span) implements Expression {}
    public record Binding(Spanned<String> name, Expression collection) {}
    public record CardinalityExpression(Expression collection, Span span) implements Expression {}

    public record TupleExpression(List<Expression> elements, Span span) implements Expression {}
    public record StructExpression(List<FieldInit> fields, Span span) implements Expression {}
    public record FieldInit(Spanned<String> name, Expression value) {}

    /** {@code target.field}; tuple indices are numeric field names. */
    public record FieldExpression(Expression target, Spanned<String> field, Span span) implements Expression {}
    public record AsExpression(Expression expression, TypeName type, Span span) implements Expression {}

    public record UnaryExpression(TokenType operator, Expression operand, Span span) implements Expression {}
    public record BinaryExpression(Expression left, TokenType operator, Expression right, Span span) implements Expression {}

    public record IfExpression(Expression condition, Expression thenBranch, Expression elseBranch, Span span) implements Expression {}
    public record LetExpression(Spanned<String> name, Expression value, Expression body, Span span) implements Expression {}
    public record MatchExpression(Expression scrutinee, List<MatchBranch> branches, Span span) implements Expression {}
    public record MatchBranch(Spanned<String> name, Optional<TypeName> type, Optional<Expression> filter, Expression body, Span span) {}

    public record ForallExpression(Spanned<String> var, Expression collection, Optional<Expression> filter, Expression body, Span span) implements Expression {}
    public record SumExpression(Spanned<String> var, Expression collection, Optional<Expression> filter, Expression body, Span span) implements Expression {}
    public record FoldExpression(
            Spanned<String> var,
            Expression collection,
            Spanned<String> accumulator,
            Expression init,
            Optional<Expression> filter,
            Expression body,
            Span span) implements Expression {}

}
