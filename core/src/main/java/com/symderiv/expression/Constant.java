package com.symderiv.expression;

import com.symderiv.exception.InvalidConstantException;

/**
 * Leaf expression holding a fixed, finite numeric value.
 *
 * <p>Integral values render without a fractional part:
 * <pre>
 *   3       -- 3.0
 *   -1      -- -1.0
 *   0.5     -- 0.5
 * </pre>
 */
public final class Constant implements Expression {

    /** Values at or beyond this magnitude render in Java's double notation. */
    private static final double PLAIN_INTEGER_LIMIT = 1e15;

    static final Constant ZERO = new Constant(0.0);
    static final Constant ONE = new Constant(1.0);

    private final double value;

    /**
     * Creates a constant.
     *
     * @param value the value
     * @throws InvalidConstantException if the value is NaN or infinite
     */
    Constant(double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidConstantException(value);
        }
        // fold -0.0 so that equal constants render and hash the same
        this.value = value == 0.0 ? 0.0 : value;
    }

    /**
     * Returns the numeric value.
     *
     * @return the value
     */
    public double value() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toDisplayString() {
        if (value == Math.rint(value) && Math.abs(value) < PLAIN_INTEGER_LIMIT) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constant)) return false;
        Constant that = (Constant) obj;
        return Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
