package com.symderiv.expression;

import java.util.Objects;

/**
 * Expression representing the sum of two operands.
 *
 * <p>Renders as {@code (left + right)}.
 */
public final class Sum implements Expression {

    private final Expression left;
    private final Expression right;
    private final int hash;

    /**
     * Creates a sum.
     *
     * @param left the left operand
     * @param right the right operand
     */
    Sum(Expression left, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.hash = Objects.hash(Sum.class.getSimpleName(), left, right);
    }

    /**
     * Returns the left operand.
     *
     * @return the left expression
     */
    public Expression left() {
        return left;
    }

    /**
     * Returns the right operand.
     *
     * @return the right expression
     */
    public Expression right() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSum(this);
    }

    @Override
    public String toDisplayString() {
        return DisplayRenderer.render(this);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sum)) return false;
        Sum that = (Sum) obj;
        return ExpressionUtils.structurallyEqual(this, that);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
