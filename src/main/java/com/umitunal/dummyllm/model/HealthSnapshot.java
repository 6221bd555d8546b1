package com.umitunal.dummyllm.model;

import com.umitunal.dummyllm.config.ModeWeights;
import com.umitunal.dummyllm.core.Mode;
import com.umitunal.dummyllm.core.StoreMetrics;

/**
 * Point-in-time view of simulator configuration and job counts.
 */
public final class HealthSnapshot {
    private final String name;
    private final long time;
    private final Mode policy;
    private final long baseLatencyMs;
    private final long seed;
    private final ModeWeights weights;
    private final StoreMetrics metrics;

    public HealthSnapshot(String name, long time, Mode policy, long baseLatencyMs, long seed,
                          ModeWeights weights, StoreMetrics metrics) {
        this.name = name;
        this.time = time;
        this.policy = policy;
        this.baseLatencyMs = baseLatencyMs;
        this.seed = seed;
        this.weights = weights;
        this.metrics = metrics;
    }

    public boolean isOk() { return true; }
    public String getName() { return name; }
    public long getTime() { return time; }
    public Mode getPolicy() { return policy; }
    public long getBaseLatencyMs() { return baseLatencyMs; }
    public long getSeed() { return seed; }

    /**
     * Weight table, or null unless the policy is {@link Mode#RANDOM}.
     */
    public ModeWeights getWeights() { return weights; }
    public StoreMetrics getMetrics() { return metrics; }

    @Override
    public String toString() {
        return String.format("HealthSnapshot{name=%s, policy=%s, latencyMs=%d, seed=%d, weights=%s, %s}",
                name, policy.wireName(), baseLatencyMs, seed, weights, metrics);
    }
}
