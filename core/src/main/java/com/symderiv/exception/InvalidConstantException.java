package com.symderiv.exception;

/**
 * Thrown when a constant would hold a non-finite value (NaN or infinity).
 */
public class InvalidConstantException extends SymbolicExpressionException {

    private final double rejectedValue;

    /**
     * Creates an invalid constant exception.
     *
     * @param rejectedValue the non-finite value that was supplied
     */
    public InvalidConstantException(double rejectedValue) {
        super(ErrorKind.INVALID_CONSTANT, "Constant value must be finite, got " + rejectedValue);
        this.rejectedValue = rejectedValue;
    }

    /**
     * Returns the value that was rejected.
     *
     * @return the non-finite value
     */
    public double getRejectedValue() {
        return rejectedValue;
    }

    @Override
    public String getUserMessage() {
        if (Double.isNaN(rejectedValue)) {
            return "Constants cannot be NaN. Check the computation that produced the value.";
        }
        return "Constants cannot be infinite. Use a finite number instead of " + rejectedValue + ".";
    }

    @Override
    protected String describeContext() {
        return "value=" + rejectedValue;
    }
}
