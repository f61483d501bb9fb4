package com.symderiv.expression;

import java.util.Objects;

/**
 * Expression representing the product of two operands.
 *
 * <p>Renders as {@code (left * right)}.
 */
public final class Product implements Expression {

    private final Expression left;
    private final Expression right;
    private final int hash;

    Product(Expression left, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.hash = Objects.hash(Product.class.getSimpleName(), left, right);
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitProduct(this);
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
        if (!(obj instanceof Product)) return false;
        Product that = (Product) obj;
        return ExpressionUtils.structurallyEqual(this, that);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
