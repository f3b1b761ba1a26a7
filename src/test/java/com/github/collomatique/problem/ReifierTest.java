package com.github.collomatique.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.collomatique.ilp.Constraint;
import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.ilp.Sign;

public class ReifierTest {

    private static final List<String> VARS = List.of("x", "y", "z");

    private static LinExpr<String> v(String name) {
        return LinExpr.var(name);
    }

    private static LinExpr<String> c(int value) {
        return LinExpr.constant(value);
    }

    private static Object[][] definitions() {
        return new Object[][] {
            { List.of(v("x").plus(v("y")).leq(c(1))) },
            { List.of(v("x").plus(v("y")).plus(v("z")).geq(c(2))) },
            { List.of(v("x").eq(v("y"))) },
            { List.of(v("x").eq(c(1)), v("z").leq(v("y"))) },
            { List.of(v("x").times(3).minus(v("y").times(2)).plus(v("z")).leq(c(0))) },
            { List.of() },
        };
    }

    /** For every assignment, r is forced to the truth value of the definition. */
    @ParameterizedTest
    @MethodSource("definitions")
    public void testReifiedVariableMatchesDefinition(List<Constraint<String>> definition) {
        var reification = Reifier.reify("r", definition, j -> "d" + j);

        for (var ones : assignments(VARS)) {
            boolean truth = definition.stream().allMatch(con -> con.isSatisfied(ones::contains));
            assertTrue(satisfiable(reification, ones, truth), () -> "r = " + truth + " rejected for " + ones);
            assertFalse(satisfiable(reification, ones, !truth), () -> "r = " + !truth + " accepted for " + ones);
        }
    }

    @Test
    public void testEqualitiesAreSplit() {
        var inequalities = Reifier.inequalities(List.of(v("x").eq(v("y")), v("z").leq(c(0))));
        assertEquals(3, inequalities.size());
        assertTrue(inequalities.stream().allMatch(i -> i.getSign() == Sign.LESS_THAN));
        assertEquals(v("x").minus(v("y")), inequalities.get(0).expr());
        assertEquals(v("y").minus(v("x")), inequalities.get(1).expr());
    }

    @Test
    public void testSingleInequalityNeedsNoHelper() {
        var reification = Reifier.reify("r", List.of(v("x").leq(c(0))), j -> "d" + j);
        assertEquals(List.of(), reification.helpers());
        assertEquals(2, reification.constraints().size());
    }

    @Test
    public void testHelperPerInequality() {
        var reification = Reifier.reify("r", List.of(v("x").eq(c(1)), v("y").leq(c(0))), j -> "d" + j);
        assertEquals(List.of("d0", "d1", "d2"), reification.helpers());
        // two indicator constraints and one link per helper, plus the conjunction
        assertEquals(3 * 3 + 1, reification.constraints().size());
    }

    @Test
    public void testEmptyDefinitionFixesVariable() {
        var reification = Reifier.reify("r", List.of(), j -> "d" + j);
        assertEquals(List.of(v("r").eq(c(1))), reification.constraints());
    }

    /** Whether some helper values satisfy the linearization with the given value of r. */
    private static boolean satisfiable(Reifier.Reification<String> reification, Set<String> ones, boolean r) {
        for (var helperOnes : assignments(reification.helpers())) {
            Set<String> all = new HashSet<>(ones);
            all.addAll(helperOnes);
            if (r) {
                all.add("r");
            }
            if (reification.constraints().stream().allMatch(con -> con.isSatisfied(all::contains))) {
                return true;
            }
        }
        return false;
    }

    private static List<Set<String>> assignments(List<String> vars) {
        List<Set<String>> result = new ArrayList<>();
        for (int mask = 0; mask < (1 << vars.size()); mask++) {
            Set<String> ones = new HashSet<>();
            for (int i = 0; i < vars.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    ones.add(vars.get(i));
                }
            }
            result.add(ones);
        }
        return result;
    }
}
