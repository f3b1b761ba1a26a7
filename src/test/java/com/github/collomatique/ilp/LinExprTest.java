package com.github.collomatique.ilp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class LinExprTest {

    private static final LinExpr<String> x = LinExpr.var("x");
    private static final LinExpr<String> y = LinExpr.var("y");

    @ParameterizedTest
    @MethodSource("arithmetic")
    public void testArithmetic(LinExpr<String> actual, LinExpr<String> expected) {
        assertEquals(expected, actual);
    }

    private static Object[][] arithmetic() {
        return new Object[][] {
            { x.plus(y).plus(x), LinExpr.of(Map.of("x", 2, "y", 1), 0) },
            { x.minus(x), LinExpr.zero() },
            { x.plus(3).times(2), LinExpr.of(Map.of("x", 2), 6) },
            { x.minus(y).negate(), LinExpr.of(Map.of("x", -1, "y", 1), 0) },
            { x.plus(y).minus(4), LinExpr.of(Map.of("x", 1, "y", 1), -4) },
        };
    }

    @Test
    public void testZeroCoefficientsAreIgnoredByEquality() {
        var withZero = LinExpr.of(Map.of("x", 0, "y", 1), 2);
        assertEquals(y.plus(2), withZero);
        assertEquals(y.plus(2).hashCode(), withZero.hashCode());
        assertEquals(Set.of("y"), withZero.cleaned().variables());
    }

    @Test
    public void testConstraintsAreNormalized() {
        // x + y <= 1 becomes x + y - 1 <= 0
        var leq = x.plus(y).leq(LinExpr.constant(1));
        assertEquals(Sign.LESS_THAN, leq.getSign());
        assertEquals(-1, leq.getConstant());
        assertEquals(x.plus(y).minus(1), leq.expr());

        var geq = x.geq(y);
        assertEquals(y.minus(x), geq.expr());

        var eq = x.eq(LinExpr.constant(1));
        assertEquals(Sign.EQUALS, eq.getSign());
        assertTrue(eq.isSatisfied(Set.of("x")::contains));
        assertFalse(eq.isSatisfied(Set.<String>of()::contains));
    }

    @Test
    public void testBounds() {
        var expr = LinExpr.of(Map.of("a", 3, "b", -2, "c", 1), 1);
        assertEquals(-1, expr.lowerBound());
        assertEquals(5, expr.upperBound());
    }

    @Test
    public void testReduceSubstitutesFixedVariables() {
        var expr = x.times(2).plus(y.times(3)).plus(1);
        assertEquals(y.times(3).plus(3), expr.reduce(Map.of("x", true)));
        assertEquals(y.times(3).plus(1), expr.reduce(Map.of("x", false)));
    }

    @Test
    public void testTransmuteMergesVariables() {
        var expr = x.plus(y.times(2));
        assertEquals(LinExpr.of(Map.of("z", 3), 0), expr.transmute(v -> "z"));
    }

    @Test
    public void testOverflowIsReported() {
        assertThrows(ArithmeticException.class, () -> x.times(Integer.MAX_VALUE).times(2));
    }

    @Test
    public void testToString() {
        assertEquals("x - 2*y + 3", x.minus(y.times(2)).plus(3).toString());
        assertEquals("0", LinExpr.zero().toString());
    }
}
