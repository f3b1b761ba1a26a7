package com.github.collomatique.ilp.solvers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.github.collomatique.ilp.FeasableConfig;
import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.ilp.Problem;
import com.github.collomatique.ilp.repr.ReprKind;

public class BfsSolverTest {

    private static Problem<String> pickTwoOfFour(ReprKind kind) {
        var vars = List.of("a", "b", "c", "d");
        LinExpr<String> sum = LinExpr.zero();
        for (var var : vars) {
            sum = sum.plus(LinExpr.var(var));
        }
        return Problem.<String>builder()
                .addVariables(vars)
                .addConstraint(sum.eq(LinExpr.constant(2)))
                .build(kind);
    }

    @ParameterizedTest
    @EnumSource(ReprKind.class)
    public void testFindsClosestFeasableConfig(ReprKind kind) {
        var problem = pickTwoOfFour(kind);
        var outcome = new BfsSolver<String>().restoreFeasability(problem.configFrom(Set.of("a")));
        var found = assertInstanceOf(SearchOutcome.Found.class, outcome);
        var config = (FeasableConfig<?>) found.feasable();
        assertEquals(2, config.variablesSetToOne().size());
        assertTrue(config.variablesSetToOne().contains("a"));
    }

    @Test
    public void testFeasableStartIsReturnedAsIs() {
        var problem = pickTwoOfFour(ReprKind.DENSE);
        var start = problem.configFrom(Set.of("b", "c"));
        var outcome = new BfsSolver<String>().restoreFeasability(start);
        assertEquals(start.intoFeasable(), outcome.config());
    }

    @Test
    public void testExclusionEnumeratesDistinctSolutions() {
        var problem = pickTwoOfFour(ReprKind.SPARSE);
        var solver = new BfsSolver<String>();
        Set<FeasableConfig<String>> seen = new HashSet<>();
        List<FeasableConfig<String>> found = new ArrayList<>();
        while (true) {
            var outcome = solver.restoreFeasability(problem.defaultConfig(), seen, SearchLimits.unlimited());
            if (outcome.config().isEmpty()) {
                assertInstanceOf(SearchOutcome.NotFound.class, outcome);
                break;
            }
            var config = outcome.config().get();
            assertTrue(seen.add(config), "solution returned twice: " + config);
            found.add(config);
        }
        // C(4, 2)
        assertEquals(6, found.size());
    }

    @Test
    public void testInfeasibleProblemIsNotFound() {
        var problem = Problem.<String>builder()
                .addVariables(List.of("a", "b"))
                .addConstraint(LinExpr.<String>var("a").plus(LinExpr.var("b")).eq(LinExpr.constant(3)))
                .build();
        var outcome = new BfsSolver<String>().restoreFeasability(problem.defaultConfig());
        assertInstanceOf(SearchOutcome.NotFound.class, outcome);
        // the whole hypercube was explored
        assertEquals(4, outcome.steps());
    }

    @Test
    public void testStepBudget() {
        var problem = pickTwoOfFour(ReprKind.DENSE);
        var limits = SearchLimits.unlimited().withMaxSteps(1);
        var outcome = new BfsSolver<String>().restoreFeasability(problem.defaultConfig(), Set.of(), limits);
        var limit = assertInstanceOf(SearchOutcome.TimeLimit.class, outcome);
        assertEquals(SearchOutcome.Reason.STEP_BUDGET, limit.reason());
    }

    @Test
    public void testCancellationIsReportedAsTimeLimit() {
        var problem = pickTwoOfFour(ReprKind.DENSE);
        var token = new CancellationToken();
        token.cancel();
        var outcome = new BfsSolver<String>().restoreFeasability(problem.defaultConfig(), Set.of(),
                SearchLimits.unlimited().withCancellation(token));
        var limit = assertInstanceOf(SearchOutcome.TimeLimit.class, outcome);
        assertEquals(SearchOutcome.Reason.CANCELLED, limit.reason());
    }

    @Test
    public void testDeadline() {
        var clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        var limits = SearchLimits.unlimited().withClock(clock).withTimeLimit(Duration.ZERO);
        var problem = pickTwoOfFour(ReprKind.DENSE);
        var outcome = new BfsSolver<String>().restoreFeasability(problem.defaultConfig(), Set.of(), limits);
        var limit = assertInstanceOf(SearchOutcome.TimeLimit.class, outcome);
        assertEquals(SearchOutcome.Reason.DEADLINE, limit.reason());
    }
}
