package com.symderiv.exception;

import com.symderiv.expression.Expression;
import com.symderiv.expression.ExpressionUtils;

/**
 * Thrown when the engine meets a node it has no rule for, such as a power
 * whose exponent is not a constant, or a tree deeper than the configured limit.
 *
 * <p>For over-deep trees the messages carry only a summary (node type, depth,
 * node count); the tree itself is never rendered.
 */
public class UnsupportedDifferentiationException extends SymbolicExpressionException {

    private final Expression offendingExpression;
    private final String offendingDescription;

    /**
     * Creates an unsupported differentiation exception.
     *
     * @param message the error message
     * @param offendingExpression the sub-expression that could not be differentiated
     */
    public UnsupportedDifferentiationException(String message, Expression offendingExpression) {
        this(message, offendingExpression, String.valueOf(offendingExpression));
    }

    private UnsupportedDifferentiationException(String message, Expression offendingExpression,
                                                String offendingDescription) {
        super(ErrorKind.UNSUPPORTED_DIFFERENTIATION, message);
        this.offendingExpression = offendingExpression;
        this.offendingDescription = offendingDescription;
    }

    /**
     * Creates the exception for a tree deeper than the engine accepts.
     *
     * @param expr the rejected tree
     * @param depth its depth
     * @param limit the configured limit
     * @return the exception
     */
    public static UnsupportedDifferentiationException depthExceeded(Expression expr, int depth, int limit) {
        String summary = String.format("%s of depth %d with %d nodes",
                                       expr.getClass().getSimpleName(), depth, ExpressionUtils.nodeCount(expr));
        return new UnsupportedDifferentiationException(
            String.format("expression depth %d exceeds the limit of %d", depth, limit), expr, summary);
    }

    /**
     * Returns the sub-expression that could not be differentiated.
     *
     * @return the offending expression
     */
    public Expression getOffendingExpression() {
        return offendingExpression;
    }

    /**
     * Returns the text used for the offending expression in messages: its
     * display string, or a summary for trees rejected by the depth limit.
     *
     * @return the description
     */
    public String getOffendingDescription() {
        return offendingDescription;
    }

    @Override
    public String getUserMessage() {
        return "Cannot differentiate " + offendingDescription + ": " + getMessage() + ".";
    }

    @Override
    protected String describeContext() {
        return "expression=" + offendingDescription;
    }
}
