package com.symderiv.calculus;

import com.symderiv.expression.Expression;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded memo of derivatives keyed by structural equality.
 *
 * <p>A derivative is stored against the pair (expression, variable name), so
 * two structurally equal subtrees share one entry no matter where they occur.
 * Entries are evicted least recently used first once the capacity is reached.
 *
 * <p>The cache only speeds up repeated work; an engine gives structurally
 * equal results with or without it. All methods are thread-safe.
 */
public final class DerivativeCache {

    private final int maxEntries;
    private final Map<Key, Expression> entries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Creates a cache.
     *
     * @param maxEntries the capacity, must be positive
     */
    public DerivativeCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, Expression> eldest) {
                return size() > DerivativeCache.this.maxEntries;
            }
        };
    }

    /**
     * Looks up the derivative of an expression.
     *
     * @param expr the expression
     * @param variableName the differentiation variable
     * @return the cached derivative, or null on a miss
     */
    public Expression get(Expression expr, String variableName) {
        Expression result;
        synchronized (entries) {
            result = entries.get(new Key(expr, variableName));
        }
        if (result != null) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return result;
    }

    /**
     * Stores a derivative.
     *
     * @param expr the expression
     * @param variableName the differentiation variable
     * @param derivative the derivative
     */
    public void put(Expression expr, String variableName, Expression derivative) {
        Objects.requireNonNull(derivative, "derivative must not be null");
        synchronized (entries) {
            entries.put(new Key(expr, variableName), derivative);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int maxEntries() {
        return maxEntries;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    /**
     * Removes all entries and resets the hit and miss counters.
     */
    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
        hits.set(0);
        misses.set(0);
    }

    private record Key(Expression expr, String variableName) {
        Key {
            Objects.requireNonNull(expr, "expr must not be null");
            Objects.requireNonNull(variableName, "variableName must not be null");
        }
    }
}
