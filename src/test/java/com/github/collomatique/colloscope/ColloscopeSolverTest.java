package com.github.collomatique.colloscope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.github.collomatique.colloscope.ColloscopeVar.GroupInSlot;
import com.github.collomatique.colloscope.ColloscopeVar.StudentInGroup;
import com.github.collomatique.ilp.repr.ReprKind;
import com.github.collomatique.problem.ProblemVar;

public class ColloscopeSolverTest {

    private static final Subject MATH = new Subject("math", "Maths", 1, 1, 2);
    private static final Slot MONDAY = new Slot("m1", "math", 0, 8 * 60, 60);
    private static final Student ANN = new Student("ann", "Ann", Set.of("math"));
    private static final Student BOB = new Student("bob", "Bob", Set.of("math"));
    private static final Group MATH_1 = new Group("math", 1);
    private static final Week W1 = new Week(1);

    private static ColloscopeData tiny(Student... students) {
        return new ColloscopeData(List.of(MATH), List.of(MONDAY), List.of(students), 1);
    }

    @ParameterizedTest
    @EnumSource(ReprKind.class)
    public void testProblemShape(ReprKind kind) {
        var solver = new ColloscopeSolver();
        solver.setReprKind(kind);
        var problem = solver.buildProblem(tiny(ANN, BOB));

        assertEquals(Set.of(new StudentInGroup(ANN, MATH_1), new StudentInGroup(BOB, MATH_1),
                new GroupInSlot(MATH_1, MONDAY, W1)), problem.baseVars());
        // $GroupUsed is shared by both scripts, $Attends exists once per student
        var reified = problem.definitions().keySet().stream()
                .map(v -> ((ProblemVar.Reified<ColloscopeVar>) v).name())
                .sorted()
                .toList();
        assertEquals(List.of("Attends", "Attends", "GroupUsed"), reified);
        assertEquals(2, solver.store().size());
    }

    @Test
    public void testSolvesTinyInstance() {
        var data = tiny(ANN, BOB);
        var colloscope = new ColloscopeSolver().solve(data).orElseThrow();

        assertEquals(Map.of(MATH_1, List.of(ANN, BOB)), colloscope.members());
        assertEquals(Optional.of(MATH_1), colloscope.groupIn(MONDAY, W1));
        assertEquals(Optional.of(MATH_1), colloscope.groupOf(BOB, "math"));
        assertEquals("math#1: Ann, Bob\nW1: m1=math#1\n", colloscope.render(data));
    }

    @Test
    public void testSolvesWithThreadsAndAnnealing() {
        var solver = new ColloscopeSolver();
        solver.setThreads(2);
        solver.setInitializer("random", 0.5);
        solver.setAnnealingIterations(5);
        solver.setSeed(42);
        var colloscope = solver.solve(tiny(ANN, BOB)).orElseThrow();
        assertEquals(Optional.of(MATH_1), colloscope.groupOf(ANN, "math"));
    }

    @Test
    public void testFixedGroupIsKept() {
        var placed = new Student("ann", "Ann", Set.of("math"), Map.of("math", 1));
        var problem = new ColloscopeSolver().buildProblem(tiny(placed, BOB));
        assertEquals(Map.of(new StudentInGroup(placed, MATH_1), true), problem.fixedVars());
    }

    @Test
    public void testInfeasibleInstance() {
        var cid = new Student("cid", "Cid", Set.of("math"));
        assertTrue(new ColloscopeSolver().solve(tiny(ANN, BOB, cid)).isEmpty());
    }

    @Test
    public void testScriptsAreCachedBetweenRuns() {
        var solver = new ColloscopeSolver();
        solver.buildProblem(tiny(ANN, BOB));
        solver.buildProblem(tiny(ANN));
        assertEquals(2, solver.store().size());
    }

    @Test
    public void testInvalidSettings() {
        var solver = new ColloscopeSolver();
        assertThrows(IllegalArgumentException.class, () -> solver.setThreads(0));
        assertThrows(IllegalArgumentException.class, () -> solver.setInitializer("greedy", 0.5));
        assertThrows(IllegalArgumentException.class, () -> ColloscopeSolver.loadScript("missing"));
    }

    @Test
    public void testInvalidData() {
        assertThrows(IllegalArgumentException.class,
                () -> new ColloscopeData(List.of(MATH, MATH), List.of(), List.of(), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ColloscopeData(List.of(MATH), List.of(new Slot("p1", "physics", 1, 600, 60)), List.of(), 1));
        assertThrows(IllegalArgumentException.class,
                () -> tiny(new Student("ann", "Ann", Set.of("math"), Map.of("math", 2))));
        assertThrows(IllegalArgumentException.class, () -> new Subject("math", "Maths", 1, 3, 2));
    }
}
