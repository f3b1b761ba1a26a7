package com.github.collomatique.ilp.repr;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.github.collomatique.ilp.Constraint;
import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.ilp.Sign;

public class ProblemReprTest {

    private static final int VARIABLES = 12;

    private static List<Constraint<Integer>> randomConstraints(Random random, int count) {
        List<Constraint<Integer>> constraints = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            var coefs = new HashMap<Integer, Integer>();
            for (int var = 0; var < VARIABLES; var++) {
                if (random.nextInt(3) == 0) {
                    coefs.put(var, random.nextInt(7) - 3);
                }
            }
            var sign = random.nextBoolean() ? Sign.LESS_THAN : Sign.EQUALS;
            constraints.add(new Constraint<>(LinExpr.of(coefs, random.nextInt(5) - 2), sign));
        }
        return constraints;
    }

    private static BitSet randomBits(Random random) {
        var bits = new BitSet();
        for (int var = 0; var < VARIABLES; var++) {
            if (random.nextBoolean()) {
                bits.set(var);
            }
        }
        return bits;
    }

    private static int[] expectedLhs(List<Constraint<Integer>> constraints, BitSet bits) {
        return constraints.stream().mapToInt(c -> c.expr().eval(bits::get)).toArray();
    }

    @ParameterizedTest
    @EnumSource(ReprKind.class)
    public void testFullComputationMatchesConstraints(ReprKind kind) {
        var random = new Random(1);
        var constraints = randomConstraints(random, 20);
        var problem = kind.create(VARIABLES, constraints);
        for (int i = 0; i < 50; i++) {
            var bits = randomBits(random);
            var config = problem.configFrom(bits);
            var data = config.precompute();
            var expected = expectedLhs(constraints, bits);
            assertArrayEquals(expected, config.computeLhs(data));
            boolean feasable = true;
            for (int c = 0; c < expected.length; c++) {
                feasable &= constraints.get(c).getSign().accepts(expected[c]);
            }
            assertEquals(feasable, config.isFeasable(data));
        }
    }

    @ParameterizedTest
    @EnumSource(ReprKind.class)
    public void testIncrementalUpdateMatchesFullComputation(ReprKind kind) {
        var random = new Random(2);
        var constraints = randomConstraints(random, 15);
        var problem = kind.create(VARIABLES, constraints);
        var config = problem.configFrom(randomBits(random));
        var data = config.precompute();
        for (int i = 0; i < 200; i++) {
            int flips = 1 + random.nextInt(3);
            for (int f = 0; f < flips; f++) {
                config = config.neighbour(random.nextInt(VARIABLES));
            }
            config.updatePrecomputation(data);
            assertArrayEquals(config.computeLhs(config.precompute()), config.computeLhs(data));
            assertEquals(config.maxDistanceToConstraint(config.precompute()), config.maxDistanceToConstraint(data));
        }
    }

    @Test
    public void testDenseAndSparseAgree() {
        var random = new Random(3);
        var constraints = randomConstraints(random, 25);
        var dense = ReprKind.DENSE.create(VARIABLES, constraints);
        var sparse = ReprKind.SPARSE.create(VARIABLES, constraints);
        for (int i = 0; i < 50; i++) {
            var bits = randomBits(random);
            var d = dense.configFrom(bits);
            var s = sparse.configFrom(bits);
            assertArrayEquals(d.computeLhs(d.precompute()), s.computeLhs(s.precompute()));
            assertEquals(d.isFeasable(d.precompute()), s.isFeasable(s.precompute()));
        }
    }

    @ParameterizedTest
    @EnumSource(ReprKind.class)
    public void testMaxDistance(ReprKind kind) {
        // x0 + x1 - 1 <= 0 and x0 - x2 = 0
        var constraints = List.of(
                new Constraint<>(LinExpr.<Integer>var(0).plus(LinExpr.var(1)).minus(1), Sign.LESS_THAN),
                new Constraint<>(LinExpr.<Integer>var(0).minus(LinExpr.var(2)), Sign.EQUALS));
        var problem = kind.create(3, constraints);
        var bits = new BitSet();
        bits.set(0);
        bits.set(1);
        var config = problem.configFrom(bits);
        assertEquals(2, config.maxDistanceToConstraint(config.precompute()));
        assertFalse(config.isFeasable(config.precompute()));
        var fixed = config.with(1, false).with(2, true);
        assertTrue(fixed.isFeasable(fixed.precompute()));
        assertEquals(0, fixed.maxDistanceToConstraint(fixed.precompute()));
    }

    @ParameterizedTest
    @EnumSource(ReprKind.class)
    public void testPrecomputationBelongsToItsProblem(ReprKind kind) {
        var random = new Random(4);
        var a = kind.create(VARIABLES, randomConstraints(random, 3));
        var b = kind.create(VARIABLES, randomConstraints(random, 3));
        var data = a.defaultConfig().precompute();
        assertThrows(IllegalStateException.class, () -> b.defaultConfig().updatePrecomputation(data));
        assertThrows(IndexOutOfBoundsException.class, () -> a.defaultConfig().with(VARIABLES, true));
    }
}
