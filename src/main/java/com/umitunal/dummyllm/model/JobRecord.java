package com.umitunal.dummyllm.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.dummyllm.core.Job;
import com.umitunal.dummyllm.core.Mode;

import java.util.Objects;

/**
 * Immutable snapshot of a simulated job.
 *
 * Every state change returns a new instance with {@code updatedAt} refreshed and
 * the version incremented, so readers never observe a half-applied transition.
 * Result and error are only ever set together with the terminal state.
 */
public final class JobRecord implements Job {
    private final String id;
    private final State state;
    private final Mode mode;
    private final String op;
    private final ObjectNode args;
    private final long timeoutMs;
    private final String traceId;
    private final long baseLatencyMs;
    private final long seed;
    private final long createdAt;
    private final long updatedAt;
    private final JobResult result;
    private final JobError error;
    private final boolean cancelRequested;
    private final long version;

    private JobRecord(Builder builder) {
        this.id = builder.id;
        this.state = State.QUEUED;
        this.mode = builder.mode;
        this.op = builder.op;
        this.args = builder.args.deepCopy();
        this.timeoutMs = builder.timeoutMs;
        this.traceId = builder.traceId;
        this.baseLatencyMs = builder.baseLatencyMs;
        this.seed = builder.seed;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.createdAt;
        this.result = null;
        this.error = null;
        this.cancelRequested = false;
        this.version = 0;
    }

    private JobRecord(JobRecord previous, State state, long updatedAt, JobResult result,
                      JobError error, boolean cancelRequested) {
        this.id = previous.id;
        this.state = state;
        this.mode = previous.mode;
        this.op = previous.op;
        this.args = previous.args;
        this.timeoutMs = previous.timeoutMs;
        this.traceId = previous.traceId;
        this.baseLatencyMs = previous.baseLatencyMs;
        this.seed = previous.seed;
        this.createdAt = previous.createdAt;
        this.updatedAt = Math.max(previous.updatedAt, updatedAt);
        this.result = result;
        this.error = error;
        this.cancelRequested = cancelRequested;
        this.version = previous.version + 1;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public State getState() {
        return state;
    }

    @Override
    public Mode getMode() {
        return mode;
    }

    @Override
    public String getOp() {
        return op;
    }

    /**
     * Returns a copy so callers cannot alter the stored request.
     */
    @Override
    public ObjectNode getArgs() {
        return args.deepCopy();
    }

    @Override
    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public String getTraceId() {
        return traceId;
    }

    @Override
    public JobResult getResult() {
        return result;
    }

    @Override
    public JobError getError() {
        return error;
    }

    @Override
    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public long getBaseLatencyMs() {
        return baseLatencyMs;
    }

    public long getSeed() {
        return seed;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    public JobRecord start(long now) {
        return new JobRecord(this, State.RUNNING, now, null, null, cancelRequested);
    }

    public JobRecord complete(JobResult result, long now) {
        return new JobRecord(this, State.OK, now, Objects.requireNonNull(result, "result"), null, cancelRequested);
    }

    /**
     * Move to FAIL, TIMEOUT or CANCELLED with the given error.
     */
    public JobRecord terminate(State terminalState, JobError error, long now) {
        if (terminalState == State.OK || !terminalState.isTerminal()) {
            throw new IllegalArgumentException("Not an error state: " + terminalState);
        }
        return new JobRecord(this, terminalState, now, null, Objects.requireNonNull(error, "error"), cancelRequested);
    }

    /**
     * Set the cancellation flag. Not a state transition, so {@code updatedAt} is kept.
     */
    public JobRecord withCancelRequested() {
        if (cancelRequested) {
            return this;
        }
        return new JobRecord(this, state, updatedAt, result, error, true);
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', state=%s, mode=%s, op='%s', version=%d, cancelRequested=%s}",
                id, state.wireName(), mode.wireName(), op, version, cancelRequested);
    }

    public static Builder newBuilder(String id, Mode mode, String op) {
        return new Builder(id, mode, op);
    }

    public static class Builder {
        private final String id;
        private final Mode mode;
        private final String op;
        private ObjectNode args = JsonNodeFactory.instance.objectNode();
        private long timeoutMs = 8000;
        private String traceId;
        private long baseLatencyMs;
        private long seed;
        private long createdAt = System.currentTimeMillis();

        private Builder(String id, Mode mode, String op) {
            this.id = Objects.requireNonNull(id, "id");
            this.mode = Objects.requireNonNull(mode, "mode");
            this.op = Objects.requireNonNull(op, "op");
            if (!mode.isConcrete()) {
                throw new IllegalArgumentException("Job mode must be concrete, got " + mode.wireName());
            }
        }

        public Builder withArgs(ObjectNode args) {
            if (args != null) {
                this.args = args;
            }
            return this;
        }

        public Builder withTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder withTraceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder withBaseLatencyMs(long baseLatencyMs) {
            this.baseLatencyMs = baseLatencyMs;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder withCreatedAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(this);
        }
    }
}
