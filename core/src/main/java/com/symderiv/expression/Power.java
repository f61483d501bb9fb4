package com.symderiv.expression;

import java.util.Objects;

/**
 * Expression representing a base raised to an exponent.
 *
 * <p>Renders as {@code (base**exponent)}, without spaces around the operator:
 * <pre>
 *   (x**2)
 *   ((x + 1)**3)
 *   (2**x)
 * </pre>
 *
 * <p>Any expression may be used as the exponent. Only constant exponents can
 * be differentiated.
 */
public final class Power implements Expression {

    private final Expression base;
    private final Expression exponent;
    private final int hash;

    /**
     * Creates a power expression.
     *
     * @param base the base
     * @param exponent the exponent
     */
    Power(Expression base, Expression exponent) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.exponent = Objects.requireNonNull(exponent, "exponent must not be null");
        this.hash = Objects.hash(Power.class.getSimpleName(), base, exponent);
    }

    /**
     * Returns the base.
     *
     * @return the base expression
     */
    public Expression base() {
        return base;
    }

    /**
     * Returns the exponent.
     *
     * @return the exponent expression
     */
    public Expression exponent() {
        return exponent;
    }

    /**
     * Returns whether the exponent is a {@link Constant}.
     *
     * @return true for constant exponents
     */
    public boolean hasConstantExponent() {
        return exponent instanceof Constant;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPower(this);
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
        if (!(obj instanceof Power)) return false;
        Power that = (Power) obj;
        return ExpressionUtils.structurallyEqual(this, that);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
