package com.umitunal.dummyllm.config;

import com.umitunal.dummyllm.core.Mode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable table of non-negative integer weights per mode.
 *
 * Iteration follows {@link Mode} declaration order, which is the canonical order
 * for weighted bucket selection. A mode with weight zero is never selected.
 */
public final class ModeWeights {
    public static final String DEFAULT_SPEC = "ok=70,echo=10,slow=10,fail=5,hang=3,timeout=2,flaky=0";

    private final Map<Mode, Integer> weights;
    private final long totalWeight;

    private ModeWeights(Map<Mode, Integer> weights) {
        EnumMap<Mode, Integer> copy = new EnumMap<>(Mode.class);
        long total = 0;
        for (Mode mode : Mode.values()) {
            if (mode == Mode.RANDOM) {
                continue;
            }
            int weight = Math.max(0, weights.getOrDefault(mode, 0));
            copy.put(mode, weight);
            total += weight;
        }
        this.weights = Collections.unmodifiableMap(copy);
        this.totalWeight = total;
    }

    public static ModeWeights of(Map<Mode, Integer> weights) {
        Objects.requireNonNull(weights, "weights");
        if (weights.getOrDefault(Mode.RANDOM, 0) > 0) {
            throw new IllegalArgumentException("random cannot carry a weight");
        }
        return new ModeWeights(weights);
    }

    public static ModeWeights defaults() {
        return parse(DEFAULT_SPEC);
    }

    /**
     * Parse {@code "ok=70,echo=10,..."}. Unknown keys and entries without '=' are
     * ignored, malformed numbers count as zero and negatives are clamped to zero.
     */
    public static ModeWeights parse(String spec) {
        EnumMap<Mode, Integer> parsed = new EnumMap<>(Mode.class);
        if (spec == null) {
            return new ModeWeights(parsed);
        }
        for (String part : spec.split(",")) {
            String entry = part.trim();
            int eq = entry.indexOf('=');
            if (entry.isEmpty() || eq < 0) {
                continue;
            }
            Mode mode = weightedModeOrNull(entry.substring(0, eq).trim());
            if (mode == null) {
                continue;
            }
            int weight;
            try {
                weight = Math.max(0, Integer.parseInt(entry.substring(eq + 1).trim()));
            } catch (NumberFormatException e) {
                weight = 0;
            }
            parsed.put(mode, weight);
        }
        return new ModeWeights(parsed);
    }

    private static Mode weightedModeOrNull(String key) {
        try {
            Mode mode = Mode.valueOf(key.toUpperCase(Locale.ROOT));
            return mode == Mode.RANDOM ? null : mode;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public int weightOf(Mode mode) {
        return weights.getOrDefault(mode, 0);
    }

    public long totalWeight() {
        return totalWeight;
    }

    public boolean isAllZero() {
        return totalWeight == 0;
    }

    /**
     * Weights in canonical order, zero entries included.
     */
    public Map<Mode, Integer> asMap() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModeWeights)) return false;
        return weights.equals(((ModeWeights) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(",");
        weights.forEach((mode, weight) -> joiner.add(mode.wireName() + "=" + weight));
        return joiner.toString();
    }
}
