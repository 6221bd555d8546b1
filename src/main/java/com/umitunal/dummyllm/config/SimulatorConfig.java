package com.umitunal.dummyllm.config;

import com.umitunal.dummyllm.core.Mode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration for a simulator instance.
 */
public class SimulatorConfig {
    public static final String ENV_MODE = "DUMMYLLM_MODE";
    public static final String ENV_RANDOM_WEIGHTS = "DUMMYLLM_RANDOM_WEIGHTS";
    public static final String ENV_LATENCY_MS = "DUMMYLLM_LATENCY_MS";
    public static final String ENV_SEED = "DUMMYLLM_SEED";

    private final Mode policy;
    private final ModeWeights weights;
    private final ModeWeights flakySplit;
    private final long baseLatencyMs;
    private final long seed;
    private final String failMessage;
    private final int executorThreads;

    private SimulatorConfig(Builder builder) {
        this.policy = builder.policy;
        this.weights = builder.weights;
        this.flakySplit = builder.flakySplit;
        this.baseLatencyMs = builder.baseLatencyMs;
        this.seed = builder.seed;
        this.failMessage = builder.failMessage;
        this.executorThreads = builder.executorThreads;
    }

    public Mode getPolicy() { return policy; }
    public ModeWeights getWeights() { return weights; }
    public ModeWeights getFlakySplit() { return flakySplit; }
    public long getBaseLatencyMs() { return baseLatencyMs; }
    public long getSeed() { return seed; }
    public String getFailMessage() { return failMessage; }
    public int getExecutorThreads() { return executorThreads; }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Default configuration: policy ok, 250 ms latency, seed 1337.
     */
    public static SimulatorConfig defaults() {
        return newBuilder().build();
    }

    /**
     * Build a configuration from the process environment.
     */
    public static SimulatorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a configuration from {@code DUMMYLLM_*} variables. Blank or malformed
     * numeric values fall back to their defaults.
     *
     * @throws IllegalArgumentException if {@code DUMMYLLM_MODE} names an unknown mode
     */
    public static SimulatorConfig fromEnvironment(Map<String, String> env) {
        Builder builder = newBuilder();
        String mode = trimToNull(env.get(ENV_MODE));
        if (mode != null) {
            builder.withPolicy(Mode.fromWireName(mode));
        }
        String weights = trimToNull(env.get(ENV_RANDOM_WEIGHTS));
        if (weights != null) {
            builder.withWeights(ModeWeights.parse(weights));
        }
        Long latency = parseLongOrNull(env.get(ENV_LATENCY_MS));
        if (latency != null) {
            builder.withBaseLatencyMs(latency);
        }
        Long seed = parseLongOrNull(env.get(ENV_SEED));
        if (seed != null) {
            builder.withSeed(seed);
        }
        return builder.build();
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static Long parseLongOrNull(String value) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return String.format("SimulatorConfig{policy=%s, weights=%s, flakySplit=%s, baseLatencyMs=%d, seed=%d, threads=%d}",
                policy.wireName(), weights, flakySplit, baseLatencyMs, seed, executorThreads);
    }

    public static class Builder {
        private Mode policy = Mode.OK;
        private ModeWeights weights = ModeWeights.defaults();
        private ModeWeights flakySplit = equalFlakySplit();
        private long baseLatencyMs = 250;
        private long seed = 1337;
        private String failMessage = "simulated error";
        private int executorThreads = 4;

        private Builder() {
        }

        /**
         * Set the global mode policy.
         * Default: ok
         */
        public Builder withPolicy(Mode policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        /**
         * Set the weight table used when the policy is random.
         * Default: ok=70,echo=10,slow=10,fail=5,hang=3,timeout=2,flaky=0
         */
        public Builder withWeights(ModeWeights weights) {
            this.weights = Objects.requireNonNull(weights, "weights");
            return this;
        }

        /**
         * Set the ok/fail/hang proportions used by the flaky policy.
         * Default: equal thirds
         */
        public Builder withFlakySplit(int ok, int fail, int hang) {
            EnumMap<Mode, Integer> split = new EnumMap<>(Mode.class);
            split.put(Mode.OK, ok);
            split.put(Mode.FAIL, fail);
            split.put(Mode.HANG, hang);
            ModeWeights candidate = ModeWeights.of(split);
            if (candidate.isAllZero()) {
                throw new IllegalArgumentException("Flaky split needs at least one positive weight");
            }
            this.flakySplit = candidate;
            return this;
        }

        /**
         * Set the base latency in milliseconds. Negative values are clamped to zero.
         * Default: 250
         */
        public Builder withBaseLatencyMs(long baseLatencyMs) {
            this.baseLatencyMs = Math.max(0, baseLatencyMs);
            return this;
        }

        /**
         * Set the seed for mode draws and reply selection.
         * Default: 1337
         */
        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Set the message reported with SIM_FAIL.
         * Default: simulated error
         */
        public Builder withFailMessage(String failMessage) {
            this.failMessage = Objects.requireNonNull(failMessage, "failMessage");
            return this;
        }

        /**
         * Set the number of scheduler threads driving job executions.
         * Default: 4
         */
        public Builder withExecutorThreads(int executorThreads) {
            if (executorThreads < 1) {
                throw new IllegalArgumentException("executorThreads must be positive");
            }
            this.executorThreads = executorThreads;
            return this;
        }

        public SimulatorConfig build() {
            return new SimulatorConfig(this);
        }

        private static ModeWeights equalFlakySplit() {
            EnumMap<Mode, Integer> split = new EnumMap<>(Mode.class);
            split.put(Mode.OK, 1);
            split.put(Mode.FAIL, 1);
            split.put(Mode.HANG, 1);
            return ModeWeights.of(split);
        }
    }
}
