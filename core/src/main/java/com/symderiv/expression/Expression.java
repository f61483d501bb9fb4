package com.symderiv.expression;

/**
 * Base interface for all nodes of an algebraic expression tree.
 *
 * <p>The set of node types is closed:
 * <ul>
 *   <li>{@link Constant} - a finite numeric value</li>
 *   <li>{@link Variable} - a named indeterminate</li>
 *   <li>{@link Sum} - {@code left + right}</li>
 *   <li>{@link Product} - {@code left * right}</li>
 *   <li>{@link Power} - {@code base ** exponent}</li>
 * </ul>
 *
 * <p>Every node is immutable. Composite nodes hold their children for life and
 * transformations such as differentiation always build new trees, so a tree
 * can be shared freely, including across threads.
 *
 * <p>Two expressions are {@code equals} when they are structurally equal:
 * same node type and recursively equal children.
 *
 * <p>Nodes are created through {@link Expressions}.
 */
public sealed interface Expression permits Constant, Variable, Sum, Product, Power {

    /**
     * Dispatches to the visitor method for this node type.
     *
     * @param visitor the visitor
     * @param <R> the visitor result type
     * @return the visitor result
     */
    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Converts this expression to its fully parenthesized textual form.
     *
     * <p>Every binary node is wrapped in parentheses, so the output never
     * depends on operator precedence:
     * <pre>
     *   (x + 1)
     *   (x * y)
     *   (x**2)
     * </pre>
     *
     * @return the display string
     */
    String toDisplayString();
}
