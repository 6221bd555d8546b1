package com.umitunal.dummyllm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Standard job submission payload: {@code {op, args, timeout_ms?, trace_id?}}.
 * Requests carry no simulation knobs; behavior comes from server configuration.
 */
public final class JobRequest {
    public static final long DEFAULT_TIMEOUT_MS = 8000;

    private final String op;
    private final ObjectNode args;
    private final long timeoutMs;
    private final String traceId;

    @JsonCreator
    public JobRequest(@JsonProperty("op") String op,
                      @JsonProperty("args") ObjectNode args,
                      @JsonProperty("timeout_ms") Long timeoutMs,
                      @JsonProperty("trace_id") String traceId) {
        this.op = op;
        this.args = args;
        this.timeoutMs = timeoutMs == null ? DEFAULT_TIMEOUT_MS : timeoutMs;
        this.traceId = traceId;
    }

    public String getOp() { return op; }
    public ObjectNode getArgs() { return args; }
    public long getTimeoutMs() { return timeoutMs; }
    public String getTraceId() { return traceId; }
}
