package com.symderiv.exception;

import java.util.Objects;

/**
 * Base class for every error raised by the expression builders and the
 * differentiation engine.
 *
 * <p>All failures are contract violations detected synchronously at the
 * offending call. Nothing is retried and nothing is recovered locally; a
 * host binding is expected to translate these into its own error convention,
 * typically using {@link #getKind()} and {@link #getUserMessage()}.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Expression d = Differentiator.derivative(expr, x);
 *   } catch (SymbolicExpressionException e) {
 *       System.err.println(e.getKind() + ": " + e.getUserMessage());
 *   }
 * </pre>
 */
public abstract class SymbolicExpressionException extends RuntimeException {

    /**
     * Error taxonomy.
     */
    public enum ErrorKind {
        INVALID_CONSTANT("InvalidConstant"),
        INVALID_VARIABLE_NAME("InvalidVariableName"),
        UNSUPPORTED_OPERAND("UnsupportedOperand"),
        NOT_A_VARIABLE("NotAVariable"),
        UNSUPPORTED_DIFFERENTIATION("UnsupportedDifferentiation");

        private final String code;

        ErrorKind(String code) {
            this.code = code;
        }

        /**
         * Returns the stable error code exposed to host bindings.
         *
         * @return the error code
         */
        public String code() {
            return code;
        }
    }

    private final ErrorKind kind;

    protected SymbolicExpressionException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected SymbolicExpressionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns the category of this failure.
     *
     * @return the error kind
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns a user-friendly error message describing how to fix the call.
     *
     * @return user-friendly error message
     */
    public abstract String getUserMessage();

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Symbolic expression error\n");
        sb.append("Kind: ").append(kind.code()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        String context = describeContext();
        if (context != null) {
            sb.append("Context: ").append(context).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    /**
     * Describes the offending value, or returns null when there is nothing to add.
     */
    protected abstract String describeContext();
}
