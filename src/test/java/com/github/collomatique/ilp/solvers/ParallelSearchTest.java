package com.github.collomatique.ilp.solvers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.ilp.Problem;
import com.github.collomatique.ilp.repr.ReprKind;

public class ParallelSearchTest {

    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    // x0 + ... + x9 = 5 and x0 + x1 <= 1
    private static Problem<Integer> problem(int target) {
        List<Integer> vars = new ArrayList<>();
        LinExpr<Integer> sum = LinExpr.zero();
        for (int i = 0; i < 10; i++) {
            vars.add(i);
            sum = sum.plus(LinExpr.var(i));
        }
        return Problem.<Integer>builder()
                .addVariables(vars)
                .addConstraint(sum.eq(LinExpr.constant(target)))
                .addConstraint(LinExpr.<Integer>var(0).plus(LinExpr.var(1)).leq(LinExpr.constant(1)))
                .build(ReprKind.SPARSE);
    }

    private static List<Config<Integer>> starts(Problem<Integer> problem, int count) {
        var init = new RandomInitializer<Integer>(0.5, new Random(11));
        List<Config<Integer>> starts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            starts.add(init.buildInitConfig(problem));
        }
        return starts;
    }

    @Test
    public void testFirstSolutionWins() {
        var problem = problem(5);
        var outcome = new ParallelSearch<>(new BfsSolver<Integer>(), executor)
                .restoreFeasability(starts(problem, 4), Set.of(), SearchLimits.unlimited());
        var found = assertInstanceOf(SearchOutcome.Found.class, outcome);
        assertTrue(outcome.config().orElseThrow().inner().isFeasable());
        assertTrue(found.steps() >= 0);
    }

    @Test
    public void testInfeasibleProblemExhaustsEveryStart() {
        // at most 9 variables can be set with x0 + x1 <= 1
        var problem = problem(10);
        var outcome = new ParallelSearch<>(new BfsSolver<Integer>(), executor)
                .restoreFeasability(starts(problem, 2), Set.of(), SearchLimits.unlimited());
        assertInstanceOf(SearchOutcome.NotFound.class, outcome);
    }

    @Test
    public void testSharedBudget() {
        var problem = problem(10);
        var budget = new AtomicLong(10);
        var outcome = new ParallelSearch<>(new BfsSolver<Integer>(), executor)
                .restoreFeasability(starts(problem, 3), Set.of(), SearchLimits.unlimited().withSharedBudget(budget));
        var limit = assertInstanceOf(SearchOutcome.TimeLimit.class, outcome);
        assertEquals(SearchOutcome.Reason.STEP_BUDGET, limit.reason());
        assertTrue(budget.get() <= 0);
    }

    @Test
    public void testAtLeastOneStartIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelSearch<>(new BfsSolver<Integer>(), executor)
                .restoreFeasability(List.of(), Set.of(), SearchLimits.unlimited()));
    }
}
