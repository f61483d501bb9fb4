package com.symderiv.expression;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders expression trees into their fully parenthesized text.
 *
 * <p>Works over an explicit stack of pending nodes and literal fragments into
 * a single {@link StringBuilder}, so rendering never fails on deep trees and
 * each character is written once.
 */
final class DisplayRenderer {

    private DisplayRenderer() {}

    static String render(Expression expr) {
        StringBuilder sb = new StringBuilder();
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(expr);
        while (!pending.isEmpty()) {
            Object item = pending.pop();
            if (item instanceof String fragment) {
                sb.append(fragment);
            } else if (item instanceof Sum sum) {
                pushBinary(pending, sum.left(), " + ", sum.right());
            } else if (item instanceof Product product) {
                pushBinary(pending, product.left(), " * ", product.right());
            } else if (item instanceof Power power) {
                pushBinary(pending, power.base(), "**", power.exponent());
            } else {
                // Constant and Variable render themselves without recursion
                sb.append(((Expression) item).toDisplayString());
            }
        }
        return sb.toString();
    }

    private static void pushBinary(Deque<Object> pending, Expression left, String operator, Expression right) {
        // reverse order: "(" is popped first
        pending.push(")");
        pending.push(right);
        pending.push(operator);
        pending.push(left);
        pending.push("(");
    }
}
