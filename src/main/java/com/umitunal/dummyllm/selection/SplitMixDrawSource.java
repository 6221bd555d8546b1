package com.umitunal.dummyllm.selection;

/**
 * SplitMix64 draw source addressed by (seed, draw index).
 *
 * Each value is the SplitMix64 finalizer applied to
 * {@code seed + (index + 1) * GOLDEN_GAMMA}, which makes any draw computable
 * without replaying the ones before it.
 */
public class SplitMixDrawSource implements DrawSource {
    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long seed;
    private long counter;

    public SplitMixDrawSource(long seed) {
        this.seed = seed;
        this.counter = 0;
    }

    @Override
    public long next() {
        long value = valueAt(seed, counter);
        counter++;
        return value;
    }

    @Override
    public long drawCount() {
        return counter;
    }

    @Override
    public long seed() {
        return seed;
    }

    /**
     * Value of the draw at {@code index} for {@code seed}, without consuming anything.
     */
    public static long valueAt(long seed, long index) {
        return mix(seed + (index + 1) * GOLDEN_GAMMA);
    }

    public static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    @Override
    public String toString() {
        return "SplitMixDrawSource{seed=" + seed + ", draws=" + counter + "}";
    }
}
