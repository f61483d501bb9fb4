package com.symderiv.exception;

/**
 * Thrown when a builder receives an operand that is neither an expression
 * nor a number.
 */
public class UnsupportedOperandException extends SymbolicExpressionException {

    private final Object operand;

    /**
     * Creates an unsupported operand exception.
     *
     * @param operand the rejected operand (may be null)
     */
    public UnsupportedOperandException(Object operand) {
        super(ErrorKind.UNSUPPORTED_OPERAND,
              "Operand must be an Expression or a Number, got " + typeName(operand));
        this.operand = operand;
    }

    /**
     * Returns the rejected operand.
     *
     * @return the operand, or null if a null operand was supplied
     */
    public Object getOperand() {
        return operand;
    }

    /**
     * Returns the simple type name of the rejected operand.
     *
     * @return the type name, or "null"
     */
    public String getOperandType() {
        return typeName(operand);
    }

    @Override
    public String getUserMessage() {
        if (operand instanceof CharSequence) {
            return "Text operands are not parsed. Build the operand with " +
                   "Expressions.variable(...) or pass a number.";
        }
        return "Unsupported operand of type " + getOperandType() +
               ". Pass an Expression or a Number.";
    }

    @Override
    protected String describeContext() {
        return "operand=" + operand + " (" + getOperandType() + ")";
    }

    private static String typeName(Object operand) {
        return operand == null ? "null" : operand.getClass().getSimpleName();
    }
}
