package com.umitunal.dummyllm.selection;

/**
 * Seeded, reproducible sequence of pseudorandom draws.
 *
 * The n-th value returned by {@link #next()} depends only on the seed and n, so
 * two sources built from the same seed agree draw for draw across processes.
 * Implementations are not thread-safe; callers serialize access.
 */
public interface DrawSource {

    /**
     * Consume one draw and return its full 64-bit value.
     */
    long next();

    /**
     * Consume exactly one draw and map it into {@code [0, bound)}.
     *
     * @param bound exclusive upper bound, must be positive
     */
    default long nextBelow(long bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return Long.remainderUnsigned(next(), bound);
    }

    /**
     * Number of draws consumed so far.
     */
    long drawCount();

    /**
     * The seed this source was built from.
     */
    long seed();
}
