package com.github.collomatique.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.collomatique.eval.ExprValue.ConstraintValue;
import com.github.collomatique.eval.ExprValue.IntValue;
import com.github.collomatique.eval.ExprValue.ListValue;
import com.github.collomatique.eval.ExprValue.StringValue;
import com.github.collomatique.eval.IlpVar.ExternVar;
import com.github.collomatique.eval.IlpVar.ScriptVar;
import com.github.collomatique.eval.IlpVar.ScriptVarListItem;
import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.parser.CheckedAst;
import com.github.collomatique.parser.Type;

public class EvaluatorTest {

    record Person(String name, int age) implements EvalObject {
        @Override
        public String typeName() {
            return "Person";
        }

        @Override
        public Optional<ExprValue> fieldAccess(ObjectEnv env, String field) {
            return switch (field) {
                case "name" -> Optional.of(new StringValue(name));
                case "age" -> Optional.of(new IntValue(age));
                default -> Optional.empty();
            };
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final TypeSchema SCHEMA = TypeSchema.builder()
            .field("Person", "name", Type.STRING)
            .field("Person", "age", Type.INT)
            .build();

    private static final List<Person> PEOPLE = List.of(new Person("ada", 36), new Person("alan", 41), new Person("grace", 85));

    private static final ObjectEnv ENV = typeName -> typeName.equals("Person") ? PEOPLE : List.of();

    // each call goes through if, let and match before recursing
    private static final String DEEP = "let depth(n: Int) -> Int = if n <= 0 { 0 } else { let m = n - 1 { "
            + "match m { k as Int where k >= 0 { 1 + depth(k) } _k as Int { 0 } } } };\n";

    @ParameterizedTest
    @MethodSource("values")
    public void testEvaluation(String body, String expected) {
        var ast = CheckedAst.compile(body, SCHEMA, Map.of());
        assertEquals(expected, ast.evalFn(ENV, "main", List.of()).toString());
    }

    private static Object[][] values() {
        return new Object[][] {
            { "pub let main() -> Int = f(42);\nlet f(x: Int) -> Int = let x = x + 1 { x };", "43" },
            { "pub let main() -> Int = 7 // 2;", "3" },
            { "pub let main() -> Int = -7 // 2;", "-3" },
            { "pub let main() -> Int = -7 % 3;", "-1" },
            { "pub let main() -> [Int] = [1 .. 4];", "[1, 2, 3]" },
            { "pub let main() -> [Int] = [x * 2 for x in [1 .. 4] where x != 2];", "[2, 6]" },
            { "pub let main() -> [(Int, Int)] = [(x, y) for x in [1 .. 3], y in [1 .. 3] where x < y];", "[(1, 2)]" },
            { "pub let main() -> Int = |[1, 2, 2, 3]|;", "3" },
            { "pub let main() -> [Int] = [1, 2] + [2, 3];", "[1, 2, 3]" },
            { "pub let main() -> [Int] = [1, 2, 3] - [2];", "[1, 3]" },
            { "pub let main() -> Bool = 2 in [1, 2];", "true" },
            { "pub let main() -> Int = fold x in [1, 2, 3] with acc = 0 { acc + x };", "6" },
            { "pub let main() -> Int = sum x in [1, 2, 3] where x > 1 { x };", "5" },
            { "pub let main() -> Bool = forall x in [1, 2] { x > 0 };", "true" },
            { "pub let main() -> Bool = forall x in [] as [Int] { x > 0 };", "true" },
            { "pub let main() -> String = if 1 < 2 { \"yes\" } else { \"no\" };", "yes" },
            { "pub let main() -> String = \"a\" + String(1 + 1);", "a2" },
            { "pub let main() -> Bool = (1, true).1;", "true" },
            { "pub let main() -> Int = { a: 1, b: 2 }.b;", "2" },
            { "pub let main() -> Bool = not (true and false) or false;", "true" },
            { "pub let main() -> [String] = [p.name for p in @[Person] where p.age > 40];", "[alan, grace]" },
            { "pub let main() -> Int = sum p in @[Person] { p.age };", "162" },
            { "type Id = Int;\npub let main() -> Int = Int(Id(4)) + 1;", "5" },
            { "enum Shape = Point | Circle(Int);\n"
                    + "let area(s: Shape) -> Int = match s { _p as Shape::Point { 0 } c as Shape::Circle { 3 * Int(c) * Int(c) } };\n"
                    + "pub let main() -> [Int] = [area(Shape::Point), area(Shape::Circle(2))];", "[0, 12]" },
            { "let fact(n: Int) -> Int = if n <= 1 { 1 } else { n * fact(n - 1) };\npub let main() -> Int = fact(10);", "3628800" },
            { "let g(x: Int) -> Int = x;\nlet f(x: Int) -> Int = g(43);\npub let main() -> Int = f(42);", "43" },
            { DEEP + "pub let main() -> Int = depth(500);", "500" },
        };
    }

    @ParameterizedTest
    @MethodSource("failures")
    public void testEvaluationErrors(String body, EvalException.Kind kind) {
        var ast = CheckedAst.compile(body);
        var e = assertThrows(EvalException.class, () -> ast.quickEvalFn("main", List.of()));
        assertEquals(kind, e.kind());
    }

    private static Object[][] failures() {
        return new Object[][] {
            { "pub let main() -> Int = 1 // (1 - 1);", EvalException.Kind.DIVISION_BY_ZERO },
            { "pub let main() -> Int = 1 % 0;", EvalException.Kind.DIVISION_BY_ZERO },
            { "pub let main() -> Int = 2147483647 + 1;", EvalException.Kind.OVERFLOW },
            { "pub let main() -> Int = 65536 * 65536;", EvalException.Kind.OVERFLOW },
            { "let down(n: Int) -> Int = down(n + 1);\npub let main() -> Int = down(0);", EvalException.Kind.RECURSION_LIMIT },
            { DEEP + "pub let main() -> Int = depth(5000);", EvalException.Kind.RECURSION_LIMIT },
        };
    }

    @Test
    public void testScriptStaysUsableAfterFailure() {
        var ast = CheckedAst.compile("pub let div(a: Int, b: Int) -> Int = a // b;");
        assertThrows(EvalException.class, () -> ast.quickEvalFn("div", List.of(new IntValue(1), new IntValue(0))));
        assertEquals(new IntValue(2), ast.quickEvalFn("div", List.of(new IntValue(4), new IntValue(2))));
    }

    @Test
    public void testCallChecks() {
        var ast = CheckedAst.compile("pub let id(a: Int) -> Int = a;");
        assertEquals(EvalException.Kind.UNKNOWN_FUNCTION,
                assertThrows(EvalException.class, () -> ast.quickEvalFn("nope", List.of())).kind());
        assertEquals(EvalException.Kind.ARGUMENT_MISMATCH,
                assertThrows(EvalException.class, () -> ast.quickEvalFn("id", List.of())).kind());
        assertEquals(EvalException.Kind.ARGUMENT_MISMATCH,
                assertThrows(EvalException.class, () -> ast.quickEvalFn("id", List.of(new StringValue("1")))).kind());
    }

    @Test
    public void testConstraintsCarryTheirOrigin() {
        var ast = CheckedAst.compile("""
                let at_most_one(k: Int) -> Constraint = $X(k) + $X(k + 1) <== 1;
                pub let all() -> Constraint = forall k in [0 .. 2] { at_most_one(k) };
                """, SCHEMA, Map.of("X", List.of(Type.INT)));
        var value = assertInstanceOf(ConstraintValue.class, ast.quickEvalFn("all", List.of()));
        assertEquals(2, value.constraints().size());

        var first = value.constraints().get(0);
        var expected = x(0).plus(x(1)).leq(LinExpr.constant(1));
        assertEquals(expected, first.constraint());
        assertEquals(Optional.of(new Origin("at_most_one", List.of(new IntValue(0)))), first.origin());
    }

    @Test
    public void testReifiedDefinitions() {
        var ast = CheckedAst.compile("""
                let pair(k: Int) -> Constraint = $X(k) === 1 and $X(k + 1) === 1;
                reify pair as $Pair;
                let split(k: Int) -> [Constraint] = [$X(k) === 1, $X(k) === 0];
                reify split as $[Split];
                pub let uses() -> Constraint = $Pair(0) + sum v in $[Split](3) { v } >== 1;
                """, SCHEMA, Map.of("X", List.of(Type.INT)));
        var session = ast.evaluator(ObjectEnv.EMPTY);
        ast.evalFn(session, "uses", List.of());

        var definitions = session.reifiedDefinitions();
        var pair = new ScriptVar("Pair", List.of(new IntValue(0)));
        assertEquals(2, definitions.get(pair).constraints().size());
        var item = new ScriptVarListItem("Split", List.of(new IntValue(3)), 1);
        assertEquals(x(3).eq(LinExpr.constant(0)), definitions.get(item).constraints().get(0).constraint());
        assertEquals(3, definitions.size());
    }

    @Test
    public void testDocstringRendering() {
        var ast = CheckedAst.compile("""
                ## Adds one to `n`, giving `n + 1`.
                ## Plain line
                pub let inc(n: Int) -> Int = n + 1;
                """);
        assertEquals(List.of("Adds one to 4, giving 5.", "Plain line"),
                ast.docstring(ObjectEnv.EMPTY, "inc", List.of(new IntValue(4))));
    }

    @Test
    public void testListsAreSets() {
        var ast = CheckedAst.compile("pub let main() -> [Int] = [g(), h(42), 42];\nlet g() -> Int = 0;\nlet h(x: Int) -> Int = x;");
        var value = assertInstanceOf(ListValue.class, ast.quickEvalFn("main", List.of()));
        assertEquals(ListValue.of(Type.INT, new IntValue(0), new IntValue(42)), value);
    }

    @Test
    public void testMissingFieldIsReportedAtTheAccess() {
        var schema = TypeSchema.builder()
                .field("Person", "name", Type.STRING)
                .field("Person", "email", Type.STRING)
                .build();
        var source = "pub let main() -> [String] = [p.email for p in @[Person]];";
        var ast = CheckedAst.compile(source, schema, Map.of());
        var e = assertThrows(EvalException.class, () -> ast.evalFn(ENV, "main", List.of()));
        assertEquals(EvalException.Kind.MISSING_FIELD, e.kind());
        assertEquals("p.email", source.substring(e.span().start(), e.span().end()));
    }

    @Test
    public void testCheckEnvRejectsBadObjects() {
        var ast = CheckedAst.compile("pub let n() -> Int = |@[Person]|;", SCHEMA, Map.of());
        ast.checkEnv(ENV);
        ObjectEnv broken = typeName -> List.of(new EvalObject() {
            @Override
            public String typeName() {
                return "Person";
            }

            @Override
            public Optional<ExprValue> fieldAccess(ObjectEnv env, String field) {
                return field.equals("name") ? Optional.of(new IntValue(1)) : Optional.empty();
            }
        });
        var e = assertThrows(EvalException.class, () -> ast.checkEnv(broken));
        assertEquals(EvalException.Kind.INVALID_OBJECT, e.kind());
    }

    private static LinExpr<IlpVar> x(int k) {
        return LinExpr.var(new ExternVar("X", List.of(new IntValue(k))));
    }
}
