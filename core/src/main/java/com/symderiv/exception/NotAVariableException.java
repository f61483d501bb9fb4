package com.symderiv.exception;

import com.symderiv.expression.Expression;

/**
 * Thrown when differentiation is requested with respect to something other
 * than a variable.
 */
public class NotAVariableException extends SymbolicExpressionException {

    private final Expression target;

    /**
     * Creates a not-a-variable exception.
     *
     * @param target the rejected differentiation target (may be null)
     */
    public NotAVariableException(Expression target) {
        super(ErrorKind.NOT_A_VARIABLE,
              "Can only differentiate with respect to a Variable, got " +
              (target == null ? "null" : target.getClass().getSimpleName() + " " + target));
        this.target = target;
    }

    /**
     * Returns the rejected differentiation target.
     *
     * @return the target, or null
     */
    public Expression getTarget() {
        return target;
    }

    @Override
    public String getUserMessage() {
        return "Differentiate with respect to a single variable, for example Expressions.variable(\"x\").";
    }

    @Override
    protected String describeContext() {
        return target == null ? "target=null" : "target=" + target;
    }
}
