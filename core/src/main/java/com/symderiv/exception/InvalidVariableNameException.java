package com.symderiv.exception;

/**
 * Thrown when a variable is created with a null, empty or blank name.
 */
public class InvalidVariableNameException extends SymbolicExpressionException {

    private final String rejectedName;

    /**
     * Creates an invalid variable name exception.
     *
     * @param rejectedName the name that was supplied (may be null)
     */
    public InvalidVariableNameException(String rejectedName) {
        super(ErrorKind.INVALID_VARIABLE_NAME,
              "Variable name must not be empty or blank, got " +
              (rejectedName == null ? "null" : "'" + rejectedName + "'"));
        this.rejectedName = rejectedName;
    }

    /**
     * Returns the name that was rejected.
     *
     * @return the rejected name, or null if none was given
     */
    public String getRejectedName() {
        return rejectedName;
    }

    @Override
    public String getUserMessage() {
        return "Variables need a non-empty name such as 'x' or 'velocity'.";
    }

    @Override
    protected String describeContext() {
        if (rejectedName == null) {
            return "name=null";
        }
        return "name='" + rejectedName + "' (length " + rejectedName.length() + ")";
    }
}
