package com.umitunal.dummyllm.selection;

import com.umitunal.dummyllm.config.ModeWeights;
import com.umitunal.dummyllm.core.Mode;

import java.util.Map;
import java.util.Objects;

/**
 * Turns the configured policy into the concrete mode of a single job.
 *
 * Each call consumes zero or one draw: fixed policies and an all-zero weight
 * table consume none, flaky and random consume exactly one. Later jobs depend on
 * that count, so no code path here may draw twice.
 */
public class ModeResolver {
    private final ModeWeights flakySplit;

    public ModeResolver(ModeWeights flakySplit) {
        this.flakySplit = Objects.requireNonNull(flakySplit, "flakySplit");
        if (flakySplit.isAllZero()) {
            throw new IllegalArgumentException("Flaky split needs at least one positive weight");
        }
        for (Map.Entry<Mode, Integer> entry : flakySplit.asMap().entrySet()) {
            if (entry.getValue() > 0 && !isFlakyOutcome(entry.getKey())) {
                throw new IllegalArgumentException("Flaky split may only weight ok, fail and hang, got "
                        + entry.getKey().wireName());
            }
        }
    }

    /**
     * Resolve the mode for one job.
     *
     * @param policy the configured global policy
     * @param weights the table used when {@code policy} is random
     * @param draws the shared draw source
     * @return a concrete mode
     */
    public Mode resolve(Mode policy, ModeWeights weights, DrawSource draws) {
        switch (policy) {
            case FLAKY:
                return select(flakySplit, draws.nextBelow(flakySplit.totalWeight()));
            case RANDOM:
                if (weights.isAllZero()) {
                    return Mode.OK;
                }
                return resolveRandom(weights, draws.next());
            default:
                return policy;
        }
    }

    /**
     * The remainder of the draw picks the bucket; in the flaky bucket the
     * quotient picks the outcome from the flaky split.
     */
    private Mode resolveRandom(ModeWeights weights, long draw) {
        long total = weights.totalWeight();
        Mode bucket = select(weights, Long.remainderUnsigned(draw, total));
        if (bucket != Mode.FLAKY) {
            return bucket;
        }
        long quotient = Long.divideUnsigned(draw, total);
        return select(flakySplit, Long.remainderUnsigned(quotient, flakySplit.totalWeight()));
    }

    /**
     * Standard weighted bucket selection over a table in canonical order.
     *
     * @param point a value in {@code [0, weights.totalWeight())}
     */
    static Mode select(ModeWeights weights, long point) {
        long upper = 0;
        for (Map.Entry<Mode, Integer> entry : weights.asMap().entrySet()) {
            int weight = entry.getValue();
            if (weight <= 0) {
                continue;
            }
            upper += weight;
            if (point < upper) {
                return entry.getKey();
            }
        }
        throw new IllegalStateException("Draw " + point + " outside total weight " + weights.totalWeight());
    }

    private static boolean isFlakyOutcome(Mode mode) {
        return mode == Mode.OK || mode == Mode.FAIL || mode == Mode.HANG;
    }
}
