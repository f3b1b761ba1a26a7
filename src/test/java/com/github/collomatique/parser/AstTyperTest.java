package com.github.collomatique.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.collomatique.eval.TypeSchema;
import com.github.collomatique.parser.CheckedAst.Signature;

public class AstTyperTest {

    private static final TypeSchema SCHEMA = TypeSchema.builder()
            .field("Student", "name", Type.STRING)
            .field("Student", "age", Type.INT)
            .build();

    private static final Map<String, List<Type>> EXTERN = Map.of("X", List.of(Type.INT));

    @ParameterizedTest
    @MethodSource("errors")
    public void testErrors(String code, SemanticError.Kind kind) {
        var e = assertThrows(SemanticException.class, () -> CheckedAst.compile(code, SCHEMA, EXTERN));
        assertTrue(e.errors().stream().anyMatch(err -> err.kind() == kind), () -> "expected " + kind + " in " + e.errors());
    }

    private static Object[][] errors() {
        return new Object[][] {
            { "pub let f() -> Int = x;", SemanticError.Kind.UNKNOWN_IDENTIFIER },
            { "pub let f() -> Int = g();", SemanticError.Kind.UNKNOWN_FUNCTION },
            { "pub let f() -> LinExpr = $V(1);", SemanticError.Kind.UNKNOWN_VARIABLE },
            { "pub let f() -> LinExpr = $X(1, 2);", SemanticError.Kind.ARGUMENT_COUNT_MISMATCH },
            { "pub let f() -> LinExpr = $[X](1);", SemanticError.Kind.UNKNOWN_VARIABLE },
            { "pub let f(x: Room) -> Int = 1;", SemanticError.Kind.UNKNOWN_TYPE },
            { "pub let f() -> [Room] = @[Room];", SemanticError.Kind.UNKNOWN_TYPE },
            { "pub let f() -> Int = 1;\npub let f() -> Int = 2;", SemanticError.Kind.FUNCTION_ALREADY_DEFINED },
            { "type Id = Int;\ntype Id = Bool;", SemanticError.Kind.TYPE_ALREADY_DEFINED },
            { "pub let f(x: Int, x: Int) -> Int = x;", SemanticError.Kind.PARAMETER_ALREADY_DEFINED },
            { "let g(x: Int) -> Int = x;\npub let f() -> Int = g(1, 2);", SemanticError.Kind.ARGUMENT_COUNT_MISMATCH },
            { "pub let f() -> Int = 1 + true;", SemanticError.Kind.TYPE_MISMATCH },
            { "pub let f() -> Bool = if true { 1 } else { false };", SemanticError.Kind.TYPE_MISMATCH },
            { "pub let f() -> Bool = 1;", SemanticError.Kind.BODY_TYPE_MISMATCH },
            { "pub let f(a: LinExpr, b: LinExpr) -> LinExpr = a * b;", SemanticError.Kind.NON_LINEAR_PRODUCT },
            { "pub let f(s: Student) -> Int = s.height;", SemanticError.Kind.UNKNOWN_FIELD },
            { "pub let f(n: Int) -> Int = n.size;", SemanticError.Kind.FIELD_ACCESS_ON_NON_OBJECT },
            { "enum E = A | B;\npub let f(e: E) -> Int = match e { x as E::A { 1 } };", SemanticError.Kind.NON_EXHAUSTIVE_MATCH },
            { "enum E = A;\npub let f() -> E = E::C;", SemanticError.Kind.UNKNOWN_VARIANT },
            { "let g() -> Int = 1;\nreify g as $G;", SemanticError.Kind.REIFY_TARGET_MISMATCH },
            { "reify g as $G;", SemanticError.Kind.UNKNOWN_FUNCTION },
            { "let c() -> Constraint = 1 === 1;\nreify c as $X;", SemanticError.Kind.VARIABLE_ALREADY_DEFINED },
            { "let c() -> Constraint = 1 === 1;\nreify c as $V;\nreify c as $V;", SemanticError.Kind.VARIABLE_ALREADY_DEFINED },
            { "pub let f() -> LinExpr = $V();\nlet c() -> Constraint = 1 === 1;\nreify c as $V;", SemanticError.Kind.UNKNOWN_VARIABLE },
            { "## `1 +`\npub let f() -> Int = 1;", SemanticError.Kind.DOCSTRING_EXPRESSION },
        };
    }

    @ParameterizedTest
    @MethodSource("warnings")
    public void testWarnings(String code, SemanticWarning.Kind kind) {
        var ast = CheckedAst.compile(code, SCHEMA, EXTERN);
        assertTrue(ast.warnings().stream().anyMatch(w -> w.kind() == kind), () -> "expected " + kind + " in " + ast.warnings());
    }

    private static Object[][] warnings() {
        return new Object[][] {
            { "let g() -> Int = 1;\npub let f() -> Int = 2;", SemanticWarning.Kind.UNUSED_FUNCTION },
            { "pub let f(x: Int) -> Int = 1;", SemanticWarning.Kind.UNUSED_IDENTIFIER },
            { "pub let f(x: Int) -> Int = let x = 2 { x };", SemanticWarning.Kind.IDENTIFIER_SHADOWED },
            { "pub let fooBar() -> Int = 1;", SemanticWarning.Kind.NAMING_CONVENTION },
            { "type id = Int;\npub let f(i: id) -> id = i;", SemanticWarning.Kind.NAMING_CONVENTION },
        };
    }

    @Test
    public void testCleanScriptHasNoWarnings() {
        var ast = CheckedAst.compile("pub let f(_x: Int, y: Int) -> Int = y + 1;");
        assertEquals(List.of(), ast.warnings());
    }

    @Test
    public void testAllErrorsAreReported() {
        var e = assertThrows(SemanticException.class,
                () -> CheckedAst.compile("pub let f() -> Int = a;\npub let g() -> Int = b;"));
        assertEquals(2, e.errors().size());
    }

    @Test
    public void testWarningsSurviveErrors() {
        var e = assertThrows(SemanticException.class,
                () -> CheckedAst.compile("let unused() -> Int = 1;\npub let f() -> Int = a;"));
        assertTrue(e.warnings().stream().anyMatch(w -> w.kind() == SemanticWarning.Kind.UNUSED_FUNCTION));
    }

    @Test
    public void testPublicSignatures() {
        var ast = CheckedAst.compile("""
                let helper(s: Student) -> Int = s.age;
                pub let total() -> Int = sum s in @[Student] { helper(s) };
                pub let named(n: String) -> [Student] = [s for s in @[Student] where s.name == n];
                pub let bound(k: Int) -> Constraint = $X(k) <== 1;
                """, SCHEMA, EXTERN);
        var expected = Map.of(
                "total", new Signature(List.of(), Type.INT),
                "named", new Signature(List.of(Type.STRING), Type.listOf(new Type.ObjectType("Student"))),
                "bound", new Signature(List.of(Type.INT), Type.CONSTRAINT));
        assertEquals(expected, ast.publicFunctions());
    }

    @Test
    public void testIntCoercesToLinExpr() {
        var ast = CheckedAst.compile("pub let f(n: Int) -> LinExpr = n + $X(n);", SCHEMA, EXTERN);
        assertEquals(Type.LIN_EXPR, ast.publicFunctions().get("f").returnType());
    }

    @Test
    public void testReifiedVariableAfterReify() {
        var ast = CheckedAst.compile("""
                let at_most(k: Int) -> Constraint = $X(k) <== 1;
                reify at_most as $AtMost;
                pub let both() -> Constraint = $AtMost(1) + $AtMost(2) >== 1;
                """, SCHEMA, EXTERN);
        assertEquals(1, ast.reifications().size());
        assertEquals("AtMost", ast.reifications().get(0).varName());
    }

    @Test
    public void testExhaustiveMatchOnEnum() {
        var ast = CheckedAst.compile("""
                enum Shape = Point | Circle(Int);
                pub let area(s: Shape) -> Int = match s {
                    _p as Shape::Point { 0 }
                    c as Shape::Circle { 3 * Int(c) * Int(c) }
                };
                """);
        assertEquals(List.of(), ast.warnings());
    }
}
