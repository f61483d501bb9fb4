package com.symderiv.expression;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Utility methods for inspecting expression trees.
 *
 * <p>All traversals use an explicit stack, so they are safe on trees too deep
 * for recursive processing. Subtrees shared by reference are visited once, so
 * the cost is linear in the number of distinct node objects even when heavy
 * sharing makes the unfolded tree exponentially large.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns the direct children of a node, left to right.
     *
     * @param expr the expression
     * @return the children, empty for leaves
     */
    public static List<Expression> children(Expression expr) {
        if (expr instanceof Sum sum) {
            return List.of(sum.left(), sum.right());
        }
        if (expr instanceof Product product) {
            return List.of(product.left(), product.right());
        }
        if (expr instanceof Power power) {
            return List.of(power.base(), power.exponent());
        }
        // Constant and Variable are leaves
        return Collections.emptyList();
    }

    /**
     * Counts the nodes of the tree as written, so a subtree referenced twice is
     * counted twice. Saturates at {@link Long#MAX_VALUE}.
     *
     * @param expr the expression
     * @return the number of nodes
     */
    public static long nodeCount(Expression expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        Map<Expression, Long> counts = new IdentityHashMap<>();
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(expr);
        while (!stack.isEmpty()) {
            Expression current = stack.peek();
            if (counts.containsKey(current)) {
                stack.pop();
                continue;
            }
            List<Expression> children = children(current);
            if (pushPending(stack, children, counts)) {
                continue;
            }
            long count = 1;
            for (Expression child : children) {
                count = saturatedAdd(count, counts.get(child));
            }
            counts.put(current, count);
            stack.pop();
        }
        return counts.get(expr);
    }

    /**
     * Returns the height of a tree. A single leaf has depth 1.
     *
     * @param expr the expression
     * @return the depth
     */
    public static int depth(Expression expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        Map<Expression, Integer> depths = new IdentityHashMap<>();
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(expr);
        while (!stack.isEmpty()) {
            Expression current = stack.peek();
            if (depths.containsKey(current)) {
                stack.pop();
                continue;
            }
            List<Expression> children = children(current);
            if (pushPending(stack, children, depths)) {
                continue;
            }
            int max = 0;
            for (Expression child : children) {
                max = Math.max(max, depths.get(child));
            }
            depths.put(current, max + 1);
            stack.pop();
        }
        return depths.get(expr);
    }

    /**
     * Returns the names of all variables in a tree, in order of first
     * occurrence reading the display string left to right.
     *
     * @param expr the expression
     * @return the variable names
     */
    public static Set<String> variables(Expression expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        Set<String> names = new LinkedHashSet<>();
        Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(expr);
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (current instanceof Variable variable) {
                names.add(variable.name());
                continue;
            }
            List<Expression> children = children(current);
            // push right first so the left child is visited first
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return names;
    }

    /**
     * Returns true if the named variable occurs anywhere in the tree.
     *
     * @param expr the expression
     * @param variableName the variable name (case-sensitive)
     * @return true if the expression mentions the variable
     */
    public static boolean dependsOn(Expression expr, String variableName) {
        Objects.requireNonNull(expr, "expr must not be null");
        Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(expr);
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (current instanceof Variable variable && variable.name().equals(variableName)) {
                return true;
            }
            for (Expression child : children(current)) {
                stack.push(child);
            }
        }
        return false;
    }

    /**
     * Compares two trees structurally: same node types, equal leaves, and
     * pairwise equal children. Backs {@code equals} of the composite nodes.
     * Each pair of node objects is compared at most once.
     *
     * @param a the first expression
     * @param b the second expression
     * @return true if the trees are structurally equal
     */
    public static boolean structurallyEqual(Expression a, Expression b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        Deque<Expression> lefts = new ArrayDeque<>();
        Deque<Expression> rights = new ArrayDeque<>();
        // pairs already compared or queued, so shared subtrees are compared once
        Map<Expression, Set<Expression>> seen = new IdentityHashMap<>();
        lefts.push(a);
        rights.push(b);
        while (!lefts.isEmpty()) {
            Expression left = lefts.pop();
            Expression right = rights.pop();
            if (left == right) {
                continue;
            }
            if (!seen.computeIfAbsent(left, k -> Collections.newSetFromMap(new IdentityHashMap<>())).add(right)) {
                continue;
            }
            if (left.getClass() != right.getClass() || left.hashCode() != right.hashCode()) {
                return false;
            }
            if (left instanceof Constant || left instanceof Variable) {
                if (!left.equals(right)) {
                    return false;
                }
                continue;
            }
            List<Expression> leftChildren = children(left);
            List<Expression> rightChildren = children(right);
            for (int i = 0; i < leftChildren.size(); i++) {
                lefts.push(leftChildren.get(i));
                rights.push(rightChildren.get(i));
            }
        }
        return true;
    }

    private static boolean pushPending(Deque<Expression> stack, List<Expression> children,
                                       Map<Expression, ?> done) {
        boolean pending = false;
        for (int i = children.size() - 1; i >= 0; i--) {
            Expression child = children.get(i);
            if (!done.containsKey(child)) {
                stack.push(child);
                pending = true;
            }
        }
        return pending;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }
}
