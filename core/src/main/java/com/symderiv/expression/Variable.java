package com.symderiv.expression;

import com.symderiv.exception.InvalidVariableNameException;

/**
 * Leaf expression holding a symbolic name.
 *
 * <p>Names are compared exactly and are case-sensitive: {@code x} and
 * {@code X} are different variables.
 */
public final class Variable implements Expression {

    private final String name;

    /**
     * Creates a variable.
     *
     * @param name the variable name
     * @throws InvalidVariableNameException if the name is null, empty or blank
     */
    Variable(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidVariableNameException(name);
        }
        this.name = name;
    }

    /**
     * Returns the variable name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Variable)) return false;
        Variable that = (Variable) obj;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
