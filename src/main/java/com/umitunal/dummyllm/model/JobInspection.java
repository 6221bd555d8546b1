package com.umitunal.dummyllm.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.dummyllm.config.ModeWeights;
import com.umitunal.dummyllm.core.Mode;

/**
 * Debug view of what a job received and how it was configured, used to verify
 * that the request and the resolved mode were not altered in transit.
 */
public final class JobInspection {
    private final String op;
    private final ObjectNode args;
    private final long timeoutMs;
    private final String traceId;
    private final Mode mode;
    private final long baseLatencyMs;
    private final long seed;
    private final ModeWeights weights;

    public JobInspection(JobRecord record, ModeWeights weights) {
        this.op = record.getOp();
        this.args = record.getArgs();
        this.timeoutMs = record.getTimeoutMs();
        this.traceId = record.getTraceId();
        this.mode = record.getMode();
        this.baseLatencyMs = record.getBaseLatencyMs();
        this.seed = record.getSeed();
        this.weights = weights;
    }

    public String getOp() { return op; }
    public ObjectNode getArgs() { return args.deepCopy(); }
    public long getTimeoutMs() { return timeoutMs; }
    public String getTraceId() { return traceId; }
    public Mode getMode() { return mode; }
    public long getBaseLatencyMs() { return baseLatencyMs; }
    public long getSeed() { return seed; }

    /**
     * Weight table in effect, or null unless the policy is {@link Mode#RANDOM}.
     */
    public ModeWeights getWeights() { return weights; }

    @Override
    public String toString() {
        return String.format("JobInspection{op='%s', mode=%s, timeoutMs=%d, traceId=%s, baseLatencyMs=%d, seed=%d, weights=%s}",
                op, mode.wireName(), timeoutMs, traceId, baseLatencyMs, seed, weights);
    }
}
