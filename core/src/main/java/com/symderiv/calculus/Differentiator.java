package com.symderiv.calculus;

import com.symderiv.exception.NotAVariableException;
import com.symderiv.exception.UnsupportedDifferentiationException;
import com.symderiv.expression.Constant;
import com.symderiv.expression.Expression;
import com.symderiv.expression.ExpressionUtils;
import com.symderiv.expression.ExpressionVisitor;
import com.symderiv.expression.Expressions;
import com.symderiv.expression.Power;
import com.symderiv.expression.Product;
import com.symderiv.expression.Sum;
import com.symderiv.expression.Variable;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes formal derivatives of expression trees, one rule per node type.
 *
 * <p>Rules, applied bottom-up:
 * <pre>
 *   d(c)/dx          = 0
 *   d(x)/dx          = 1,  d(y)/dx = 0
 *   d(a + b)/dx      = d(a)/dx + d(b)/dx
 *   d(a * b)/dx      = d(a)/dx * b + a * d(b)/dx
 *   d(f ** n)/dx     = (n * f ** (n - 1)) * d(f)/dx     (n constant)
 * </pre>
 *
 * <p>No simplification is performed. The result of each rule is built exactly
 * as written above, so derivatives keep terms such as {@code (x * 1)} and a
 * trailing {@code * 1} chain factor when the base is the variable itself.
 *
 * <p>The input tree is never modified. Either a complete derivative is
 * returned or an exception is thrown; there are no partial results. The
 * traversal uses an explicit stack, so tree depth is bounded only by the
 * configured limit, not by the call stack.
 *
 * <p>Example usage:
 * <pre>
 *   Variable x = Expressions.variable("x");
 *   Expression d = Differentiator.derivative(Expressions.multiply(x, x), x);
 *   d.toDisplayString();   // ((1 * x) + (x * 1))
 * </pre>
 *
 * <p>Instances are thread-safe.
 */
public final class Differentiator {

    private static final Logger logger = LoggerFactory.getLogger(Differentiator.class);

    private final DifferentiationConfig config;
    private final DerivativeCache cache;

    /**
     * Creates an engine with the default configuration.
     */
    public Differentiator() {
        this(DifferentiationConfig.defaults());
    }

    /**
     * Creates an engine.
     *
     * @param config the configuration
     */
    public Differentiator(DifferentiationConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.cache = config.isCacheEnabled() ? new DerivativeCache(config.cacheMaxEntries()) : null;
    }

    /**
     * Returns the shared engine configured from system properties.
     *
     * @return the shared engine
     */
    public static Differentiator getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Differentiates with the shared engine.
     *
     * @param expr the expression
     * @param withRespectTo the differentiation variable
     * @return the derivative
     * @see #differentiate(Expression, Expression)
     */
    public static Expression derivative(Expression expr, Expression withRespectTo) {
        return getDefault().differentiate(expr, withRespectTo);
    }

    public DifferentiationConfig config() {
        return config;
    }

    /**
     * Returns the derivative cache, present only when caching is enabled.
     *
     * @return the cache
     */
    public Optional<DerivativeCache> cache() {
        return Optional.ofNullable(cache);
    }

    /**
     * Computes {@code d(expr)/d(withRespectTo)}.
     *
     * @param expr the expression to differentiate
     * @param withRespectTo the differentiation variable
     * @return the derivative, a new tree
     * @throws NotAVariableException if withRespectTo is not a {@link Variable}
     * @throws UnsupportedDifferentiationException if the tree contains a power
     *         with a non-constant exponent, or is deeper than the configured limit
     * @throws NullPointerException if expr is null
     */
    public Expression differentiate(Expression expr, Expression withRespectTo) {
        Variable variable = requireVariable(withRespectTo);
        Objects.requireNonNull(expr, "expr must not be null");

        int depth = ExpressionUtils.depth(expr);
        if (depth > config.maxDepth()) {
            throw UnsupportedDifferentiationException.depthExceeded(expr, depth, config.maxDepth());
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Differentiating expression of depth {} and {} nodes with respect to {}",
                         depth, ExpressionUtils.nodeCount(expr), variable.name());
        }

        return derive(expr, variable.name());
    }

    /**
     * Computes the derivative of the given order by differentiating repeatedly.
     *
     * @param expr the expression to differentiate
     * @param withRespectTo the differentiation variable
     * @param order how many times to differentiate; 0 returns expr unchanged
     * @return the derivative
     * @throws IllegalArgumentException if order is negative
     * @see #differentiate(Expression, Expression)
     */
    public Expression differentiate(Expression expr, Expression withRespectTo, int order) {
        if (order < 0) {
            throw new IllegalArgumentException("order must not be negative, got " + order);
        }
        requireVariable(withRespectTo);
        Objects.requireNonNull(expr, "expr must not be null");

        Expression result = expr;
        for (int i = 0; i < order; i++) {
            result = differentiate(result, withRespectTo);
        }
        return result;
    }

    private static Variable requireVariable(Expression withRespectTo) {
        if (withRespectTo instanceof Variable variable) {
            return variable;
        }
        throw new NotAVariableException(withRespectTo);
    }

    /**
     * Post-order pass over an explicit stack. A node is derived once all the
     * children its rule needs are derived; subtrees shared by reference are
     * derived once per pass.
     */
    private Expression derive(Expression root, String variableName) {
        Map<Expression, Expression> derived = new IdentityHashMap<>();
        Set<Expression> expanded = Collections.newSetFromMap(new IdentityHashMap<>());
        RuleVisitor rules = new RuleVisitor(variableName, derived);
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            Expression current = stack.peek();
            if (derived.containsKey(current)) {
                stack.pop();
                continue;
            }
            if (expanded.add(current)) {
                if (cache != null) {
                    Expression cached = cache.get(current, variableName);
                    if (cached != null) {
                        derived.put(current, cached);
                        stack.pop();
                        continue;
                    }
                }
                List<Expression> needed = requiredChildren(current);
                boolean pending = false;
                // push right first so the left operand is derived first
                for (int i = needed.size() - 1; i >= 0; i--) {
                    if (!derived.containsKey(needed.get(i))) {
                        stack.push(needed.get(i));
                        pending = true;
                    }
                }
                if (pending) {
                    continue;
                }
            }
            Expression result = current.accept(rules);
            stack.pop();
            derived.put(current, result);
            if (cache != null) {
                cache.put(current, variableName, result);
            }
        }
        return derived.get(root);
    }

    private static List<Expression> requiredChildren(Expression expr) {
        if (expr instanceof Power power) {
            constantExponent(power);
            return List.of(power.base());
        }
        return ExpressionUtils.children(expr);
    }

    private static Constant constantExponent(Power power) {
        if (power.exponent() instanceof Constant exponent) {
            return exponent;
        }
        throw new UnsupportedDifferentiationException(
            "exponent " + power.exponent() + " is not a constant", power);
    }

    /**
     * Applies one rule to one node. Children's derivatives are already in
     * {@code derived} when a node is visited.
     */
    private static final class RuleVisitor implements ExpressionVisitor<Expression> {

        private final String variableName;
        private final Map<Expression, Expression> derived;

        RuleVisitor(String variableName, Map<Expression, Expression> derived) {
            this.variableName = variableName;
            this.derived = derived;
        }

        private Expression derivativeOf(Expression child) {
            return derived.get(child);
        }

        @Override
        public Expression visitConstant(Constant constant) {
            return Expressions.constant(0);
        }

        @Override
        public Expression visitVariable(Variable variable) {
            return Expressions.constant(variable.name().equals(variableName) ? 1 : 0);
        }

        @Override
        public Expression visitSum(Sum sum) {
            return Expressions.sum(derivativeOf(sum.left()), derivativeOf(sum.right()));
        }

        @Override
        public Expression visitProduct(Product product) {
            Expression left = product.left();
            Expression right = product.right();
            return Expressions.sum(
                Expressions.product(derivativeOf(left), right),
                Expressions.product(left, derivativeOf(right)));
        }

        @Override
        public Expression visitPower(Power power) {
            double n = constantExponent(power).value();
            Expression base = power.base();
            return Expressions.product(
                Expressions.product(
                    Expressions.constant(n),
                    Expressions.power(base, Expressions.constant(n - 1))),
                derivativeOf(base));
        }
    }

    private static final class DefaultHolder {
        static final Differentiator INSTANCE = new Differentiator(DifferentiationConfig.fromSystemProperties());
    }
}
