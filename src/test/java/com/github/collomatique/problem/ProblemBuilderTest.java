package com.github.collomatique.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.github.collomatique.eval.ExprValue.IntValue;
import com.github.collomatique.eval.IlpVar.ExternVar;
import com.github.collomatique.eval.ObjectEnv;
import com.github.collomatique.eval.Origin;
import com.github.collomatique.eval.TypeSchema;
import com.github.collomatique.ilp.ModelException;
import com.github.collomatique.ilp.repr.ReprKind;
import com.github.collomatique.ilp.solvers.BfsSolver;
import com.github.collomatique.parser.Type;
import com.github.collomatique.problem.ColloProblem.ConstraintDesc;
import com.github.collomatique.problem.ProblemVar.Base;
import com.github.collomatique.problem.ProblemVar.Reified;

public class ProblemBuilderTest {

    /** {@code $X(i)} for i in 0..3 is free, {@code $X(9)} is fixed to one. */
    static class Bits implements EvalVars<String> {
        @Override
        public Map<String, List<Type>> fieldSchema() {
            return Map.of("X", List.of(Type.INT));
        }

        @Override
        public Set<String> vars(ObjectEnv env) {
            return new LinkedHashSet<>(List.of("x0", "x1", "x2", "x3", "x9"));
        }

        @Override
        public Optional<String> fromExtern(ExternVar var) {
            if (!var.name().equals("X") || !(var.params().get(0) instanceof IntValue i)) {
                return Optional.empty();
            }
            int n = i.value();
            return (n >= 0 && n < 4) || n == 9 ? Optional.of("x" + n) : Optional.empty();
        }

        @Override
        public Optional<Boolean> fix(String var) {
            return var.equals("x9") ? Optional.of(true) : Optional.empty();
        }
    }

    private ScriptStore store;
    private ProblemBuilder<String> builder;

    @BeforeEach
    public void setUp() {
        store = new ScriptStore(TypeSchema.empty());
        builder = new ProblemBuilder<>(ObjectEnv.EMPTY, store, new Bits());
    }

    @Test
    public void testPlainConstraints() {
        var script = new Script("plain", "pub let at_most_one() -> Constraint = sum i in [0 .. 4] { $X(i) } <== 1;");
        builder.addConstraints(script, List.of(FnCall.of("at_most_one")));
        var problem = builder.build();

        assertEquals(Set.of("x0", "x1", "x2", "x3"), problem.baseVars());
        assertEquals(Map.of("x9", true), problem.fixedVars());
        assertEquals(4, problem.problem().variables().size());
        assertEquals(1, problem.constraints().size());

        var desc = assertInstanceOf(ConstraintDesc.FromScript.class, problem.constraints().get(0).desc());
        assertEquals(script.ref(), desc.script());
        assertEquals(Optional.of(new Origin("at_most_one", List.of())), desc.origin());

        assertTrue(problem.solutionFromData(Set.of("x2")).isFeasable());
        var bad = problem.solutionFromData(Set.of("x0", "x1"));
        assertFalse(bad.isFeasable());
        assertEquals(1, bad.blame().size());
    }

    @ParameterizedTest
    @EnumSource(ReprKind.class)
    public void testInternalReificationForcesItsDefinition(ReprKind kind) {
        var script = new Script("pairs", """
                let both(i: Int) -> Constraint = $X(i) === 1 and $X(i + 1) === 1;
                reify both as $Both;
                pub let need() -> Constraint = $Both(0) === 1;
                """);
        builder.addConstraints(script, List.of(FnCall.of("need")));
        var problem = builder.build(kind);

        var both = new Reified<String>(script.ref(), "Both", List.of(new IntValue(0)));
        assertEquals(Set.of(both), problem.definitions().keySet());
        // two equalities give four inequalities, each with a helper
        assertEquals(4 + 1 + 4, problem.problem().variables().size());

        var outcome = new BfsSolver<ProblemVar<String>>().restoreFeasability(problem.problem().defaultConfig());
        var solution = problem.solution(outcome.config().orElseThrow());
        assertEquals(Set.of("x0", "x1", "x9"), solution.data());
        assertTrue(solution.completeData().get(both));

        assertTrue(problem.solutionFromData(Set.of("x0", "x1", "x3")).isFeasable());
        var bad = problem.solutionFromData(Set.of("x0"));
        assertFalse(bad.isFeasable());
        assertTrue(bad.blame().stream().anyMatch(c -> c.desc() instanceof ConstraintDesc.FromScript));
    }

    @Test
    public void testReifiedVariableLists() {
        var script = new Script("lists", """
                let each(i: Int) -> [Constraint] = [$X(i) === 1, $X(i + 1) === 1];
                reify each as $[Each];
                pub let some() -> Constraint = sum v in $[Each](0) { v } >== 1;
                """);
        builder.addConstraints(script, List.of(FnCall.of("some")));
        var problem = builder.build();

        assertEquals(2, problem.definitions().size());
        assertTrue(problem.solutionFromData(Set.of("x1")).isFeasable());
        assertTrue(problem.solutionFromData(Set.of("x0")).isFeasable());
        assertFalse(problem.solutionFromData(Set.of("x2", "x3")).isFeasable());
    }

    @Test
    public void testGlobalReification() {
        var pairs = new Script("pairs", "pub let pair(i: Int) -> Constraint = $X(i) + $X(i + 1) >== 2;");
        var users = new Script("users", "pub let either() -> Constraint = $Pair(0) + $Pair(2) >== 1;");
        builder.addReifiedVariables(pairs, Map.of("pair", "Pair"));
        assertEquals(List.of(Type.INT), builder.declaredVars().get("Pair"));
        builder.addConstraints(users, List.of(FnCall.of("either")));
        var problem = builder.build();

        assertTrue(problem.definitions().containsKey(new Reified<String>(pairs.ref(), "Pair", List.of(new IntValue(0)))));
        assertTrue(problem.definitions().containsKey(new Reified<String>(pairs.ref(), "Pair", List.of(new IntValue(2)))));
        assertTrue(problem.solutionFromData(Set.of("x2", "x3")).isFeasable());
        assertFalse(problem.solutionFromData(Set.of("x0", "x2")).isFeasable());
    }

    @Test
    public void testFixedVariablesAreConstants() {
        var script = new Script("fixed", "pub let exclusive() -> Constraint = $X(9) + $X(0) <== 1;");
        builder.addConstraints(script, List.of(FnCall.of("exclusive")));
        var problem = builder.build();

        assertEquals(Map.of(new Base<>("x9"), true), problem.problem().constants());
        var empty = problem.solutionFromData(Set.of());
        assertTrue(empty.isFeasable());
        assertTrue(empty.get("x9"));
        assertEquals(Set.of("x9"), empty.data());
        assertFalse(problem.solutionFromData(Set.of("x0")).isFeasable());
    }

    @Test
    public void testObjective() {
        var script = new Script("objective", "pub let count() -> LinExpr = sum i in [0 .. 4] { $X(i) };");
        builder.addObjective(script, FnCall.of("count"), 2, ObjectiveSense.MAXIMIZE);
        var problem = builder.build();
        assertEquals(-4, problem.solutionFromData(Set.of("x0", "x3")).objectiveValue());
        assertEquals(0, problem.solutionFromData(Set.of()).objectiveValue());
    }

    @Test
    public void testScriptsAreCompiledOnce() {
        var script = new Script("plain", "pub let none() -> Constraint = $X(0) === 0;");
        builder.addConstraints(script, List.of(FnCall.of("none")));
        new ProblemBuilder<>(ObjectEnv.EMPTY, store, new Bits()).addConstraints(script, List.of(FnCall.of("none")));
        assertEquals(1, store.size());
    }

    @Test
    public void testUnknownDomainVariable() {
        var script = new Script("bad", "pub let bad() -> Constraint = $X(5) === 0;");
        var e = assertThrows(ModelException.class, () -> builder.addConstraints(script, List.of(FnCall.of("bad"))));
        assertEquals(ModelException.Kind.UNKNOWN_DOMAIN_VARIABLE, e.kind());
    }

    @Test
    public void testCallErrors() {
        var script = new Script("calls", """
                let hidden() -> Constraint = $X(0) === 0;
                pub let shown() -> Constraint = hidden();
                pub let number() -> Int = 1;
                pub let expr() -> LinExpr = $X(0);
                """);
        assertEquals(ModelException.Kind.UNKNOWN_FUNCTION, assertThrows(ModelException.class,
                () -> builder.addConstraints(script, List.of(FnCall.of("hidden")))).kind());
        assertEquals(ModelException.Kind.SCHEMA_MISMATCH, assertThrows(ModelException.class,
                () -> builder.addConstraints(script, List.of(FnCall.of("number")))).kind());
        assertEquals(ModelException.Kind.SCHEMA_MISMATCH, assertThrows(ModelException.class,
                () -> builder.addReifiedVariables(script, Map.of("expr", "Expr"))).kind());
        assertEquals(ModelException.Kind.REIFICATION_ALREADY_DECLARED, assertThrows(ModelException.class,
                () -> builder.addReifiedVariables(script, Map.of("shown", "X"))).kind());
    }

    @Test
    public void testSolutionOfAnotherProblem() {
        var script = new Script("plain", "pub let none() -> Constraint = $X(0) === 0;");
        builder.addConstraints(script, List.of(FnCall.of("none")));
        var first = builder.build();
        var second = builder.build();
        assertThrows(IllegalArgumentException.class, () -> first.solution(second.problem().defaultConfig()));
    }
}
