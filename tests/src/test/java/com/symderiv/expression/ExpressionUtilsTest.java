package com.symderiv.expression;

import com.symderiv.test.TestBase;
import com.symderiv.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static com.symderiv.expression.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExpressionUtils}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("ExpressionUtils Tests")
public class ExpressionUtilsTest extends TestBase {

    private final Variable x = variable("x");
    private final Variable y = variable("y");

    @Test
    @DisplayName("Leaves have no children, composites have two")
    void testChildren() {
        assertThat(ExpressionUtils.children(x)).isEmpty();
        assertThat(ExpressionUtils.children(constant(4))).isEmpty();
        assertThat(ExpressionUtils.children(add(x, y))).containsExactly(x, y);
        assertThat(ExpressionUtils.children(raise(y, 2))).containsExactly(y, constant(2));
    }

    @Test
    @DisplayName("nodeCount counts every node")
    void testNodeCount() {
        assertThat(ExpressionUtils.nodeCount(x)).isEqualTo(1);
        assertThat(ExpressionUtils.nodeCount(add(x, 1))).isEqualTo(3);
        // ((x * y) + (x**2))
        assertThat(ExpressionUtils.nodeCount(add(multiply(x, y), raise(x, 2)))).isEqualTo(7);
    }

    @Test
    @DisplayName("depth of a leaf is 1")
    void testDepth() {
        assertThat(ExpressionUtils.depth(constant(1))).isEqualTo(1);
        assertThat(ExpressionUtils.depth(add(x, 1))).isEqualTo(2);
        assertThat(ExpressionUtils.depth(add(x, raise(add(y, 1), 2)))).isEqualTo(4);
    }

    @Test
    @DisplayName("depth handles trees too deep for recursion")
    void testDepthOfDeepTree() {
        Expression e = x;
        for (int i = 0; i < 100_000; i++) {
            e = add(e, 1);
        }

        assertThat(ExpressionUtils.depth(e)).isEqualTo(100_001);
        assertThat(ExpressionUtils.nodeCount(e)).isEqualTo(200_001);
    }

    @Test
    @DisplayName("variables are listed in order of first occurrence")
    void testVariables() {
        Expression e = add(multiply(variable("b"), variable("a")), raise(variable("b"), variable("c")));

        assertThat(ExpressionUtils.variables(e)).containsExactly("b", "a", "c");
        assertThat(ExpressionUtils.variables(constant(3))).isEmpty();
    }

    @Test
    @DisplayName("dependsOn is case-sensitive")
    void testDependsOn() {
        Expression e = multiply(x, raise(y, 2));

        assertThat(ExpressionUtils.dependsOn(e, "x")).isTrue();
        assertThat(ExpressionUtils.dependsOn(e, "y")).isTrue();
        assertThat(ExpressionUtils.dependsOn(e, "X")).isFalse();
        assertThat(ExpressionUtils.dependsOn(constant(2), "x")).isFalse();
    }

    @Test
    @DisplayName("Shared subtrees are measured once")
    @Timeout(10)
    void testSharedSubtrees() {
        Expression e = x;
        for (int i = 0; i < 40; i++) {
            e = multiply(e, e);
        }

        assertThat(ExpressionUtils.depth(e)).isEqualTo(41);
        // counted as written: 2^41 - 1 nodes
        assertThat(ExpressionUtils.nodeCount(e)).isEqualTo((1L << 41) - 1);
        assertThat(ExpressionUtils.variables(e)).containsExactly("x");
        assertThat(ExpressionUtils.dependsOn(e, "x")).isTrue();
        assertThat(ExpressionUtils.dependsOn(e, "y")).isFalse();
    }

    @Test
    @DisplayName("nodeCount saturates instead of overflowing")
    @Timeout(10)
    void testNodeCountSaturates() {
        Expression e = x;
        for (int i = 0; i < 70; i++) {
            e = add(e, e);
        }

        assertThat(ExpressionUtils.nodeCount(e)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("structurallyEqual compares node types and operands")
    void testStructurallyEqual() {
        assertThat(ExpressionUtils.structurallyEqual(add(x, raise(y, 2)), add(variable("x"), raise(variable("y"), 2))))
            .isTrue();
        assertThat(ExpressionUtils.structurallyEqual(add(x, y), multiply(x, y))).isFalse();
        assertThat(ExpressionUtils.structurallyEqual(add(x, y), add(y, x))).isFalse();
        assertThat(ExpressionUtils.structurallyEqual(constant(2), constant(2.0))).isTrue();
    }

    @Test
    @DisplayName("structurallyEqual walks shared trees without expanding them")
    @Timeout(10)
    void testStructurallyEqualShared() {
        Expression a = x;
        Expression b = variable("x");
        for (int i = 0; i < 40; i++) {
            a = multiply(a, a);
            b = multiply(b, b);
        }

        assertThat(ExpressionUtils.structurallyEqual(a, b)).isTrue();
        assertThat(a).isEqualTo(b);
    }
}
