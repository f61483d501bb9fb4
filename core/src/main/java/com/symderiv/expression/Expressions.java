package com.symderiv.expression;

import com.symderiv.exception.InvalidConstantException;
import com.symderiv.exception.InvalidVariableNameException;
import com.symderiv.exception.UnsupportedOperandException;
import java.util.Objects;

/**
 * Builder helpers for expression trees.
 *
 * <p>This is the only way to create expression nodes. The untyped builders
 * ({@link #add(Object, Object)}, {@link #multiply(Object, Object)},
 * {@link #raise(Object, Object)}) accept either an {@link Expression} or a
 * {@link Number} for each operand; numbers are turned into constants by
 * {@link #toExpression(Object)}.
 *
 * <p>Example usage:
 * <pre>
 *   Variable x = Expressions.variable("x");
 *   Expression e = Expressions.add(Expressions.raise(x, 2), 5);
 *   e.toDisplayString();   // ((x**2) + 5)
 * </pre>
 */
public final class Expressions {

    private Expressions() {}

    // ==================== Leaves ====================

    /**
     * Creates a constant.
     *
     * @param value the value
     * @return the constant expression
     * @throws InvalidConstantException if the value is NaN or infinite
     */
    public static Constant constant(double value) {
        if (value == 0.0) {
            return Constant.ZERO;
        }
        if (value == 1.0) {
            return Constant.ONE;
        }
        return new Constant(value);
    }

    /**
     * Creates a variable.
     *
     * @param name the variable name
     * @return the variable expression
     * @throws InvalidVariableNameException if the name is null, empty or blank
     */
    public static Variable variable(String name) {
        return new Variable(name);
    }

    /**
     * Creates a constant. Alias of {@link #constant(double)} for host bindings.
     *
     * @param value the value
     * @return the constant expression
     * @throws InvalidConstantException if the value is NaN or infinite
     */
    public static Constant makeConstant(double value) {
        return constant(value);
    }

    /**
     * Creates a variable. Alias of {@link #variable(String)} for host bindings.
     *
     * @param name the variable name
     * @return the variable expression
     * @throws InvalidVariableNameException if the name is null, empty or blank
     */
    public static Variable makeVariable(String name) {
        return variable(name);
    }

    // ==================== Typed composites ====================

    /**
     * Builds {@code (left + right)} from existing expressions.
     *
     * @param left the left operand
     * @param right the right operand
     * @return the sum
     * @throws NullPointerException if an operand is null
     */
    public static Sum sum(Expression left, Expression right) {
        return new Sum(left, right);
    }

    /**
     * Builds {@code (left * right)} from existing expressions.
     *
     * @param left the left operand
     * @param right the right operand
     * @return the product
     * @throws NullPointerException if an operand is null
     */
    public static Product product(Expression left, Expression right) {
        return new Product(left, right);
    }

    /**
     * Builds {@code (base**exponent)} from existing expressions.
     *
     * @param base the base
     * @param exponent the exponent
     * @return the power
     * @throws NullPointerException if an operand is null
     */
    public static Power power(Expression base, Expression exponent) {
        return new Power(base, exponent);
    }

    // ==================== Coercing composites ====================

    /**
     * Builds {@code (a + b)}.
     *
     * @param a an Expression or a Number
     * @param b an Expression or a Number
     * @return the sum
     * @throws UnsupportedOperandException if an operand is neither
     * @throws InvalidConstantException if a numeric operand is not finite
     */
    public static Sum add(Object a, Object b) {
        return new Sum(toExpression(a), toExpression(b));
    }

    /**
     * Builds {@code (a * b)}.
     *
     * @param a an Expression or a Number
     * @param b an Expression or a Number
     * @return the product
     * @throws UnsupportedOperandException if an operand is neither
     * @throws InvalidConstantException if a numeric operand is not finite
     */
    public static Product multiply(Object a, Object b) {
        return new Product(toExpression(a), toExpression(b));
    }

    /**
     * Builds {@code (a**b)}.
     *
     * @param a the base, an Expression or a Number
     * @param b the exponent, an Expression or a Number
     * @return the power
     * @throws UnsupportedOperandException if an operand is neither
     * @throws InvalidConstantException if a numeric operand is not finite
     */
    public static Power raise(Object a, Object b) {
        return new Power(toExpression(a), toExpression(b));
    }

    /**
     * Converts a builder operand into an expression.
     *
     * <p>Expressions are returned as-is, numbers become a {@link Constant} of
     * their {@code doubleValue()}. Everything else, null included, is rejected.
     *
     * @param operand the operand
     * @return the operand as an expression
     * @throws UnsupportedOperandException if the operand is neither an Expression nor a Number
     * @throws InvalidConstantException if a numeric operand is not finite
     */
    public static Expression toExpression(Object operand) {
        if (operand instanceof Expression expr) {
            return expr;
        }
        if (operand instanceof Number number) {
            return constant(number.doubleValue());
        }
        throw new UnsupportedOperandException(operand);
    }

    // ==================== Rendering ====================

    /**
     * Renders an expression in its fully parenthesized form.
     *
     * @param expr the expression
     * @return the display string
     * @see Expression#toDisplayString()
     */
    public static String toDisplayString(Expression expr) {
        return Objects.requireNonNull(expr, "expr must not be null").toDisplayString();
    }
}
