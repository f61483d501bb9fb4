package com.symderiv.expression;

/**
 * Visitor over the closed set of expression node types.
 *
 * <p>Each node type has its own method, so a new node type cannot be added
 * without every visitor being updated.
 *
 * @param <R> the result type
 */
public interface ExpressionVisitor<R> {

    R visitConstant(Constant constant);

    R visitVariable(Variable variable);

    R visitSum(Sum sum);

    R visitProduct(Product product);

    R visitPower(Power power);
}
