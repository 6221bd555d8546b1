package com.umitunal.dummyllm.model;

import java.util.Objects;

/**
 * Simulated error attached to a job in state FAIL, TIMEOUT or CANCELLED.
 */
public final class JobError {
    public static final String SIM_FAIL = "SIM_FAIL";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String CANCELLED = "CANCELLED";

    private final String code;
    private final String message;

    public JobError(String code, String message) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
    }

    public static JobError simulatedFailure(String message) {
        return new JobError(SIM_FAIL, message);
    }

    public static JobError simulatedTimeout() {
        return new JobError(TIMEOUT, "simulated timeout");
    }

    public static JobError cancelledByClient() {
        return new JobError(CANCELLED, "cancelled by client");
    }

    public String getCode() { return code; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobError)) return false;
        JobError that = (JobError) o;
        return code.equals(that.code) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        return "JobError{code=" + code + ", message='" + message + "'}";
    }
}
