package com.umitunal.dummyllm.core;

/**
 * Thrown when a mutation targets a job that has already reached a terminal state.
 */
public class AlreadyTerminalException extends SimulatorException {
    private final Job.State state;

    public AlreadyTerminalException(String jobId, Job.State state) {
        super(jobId, "Job " + jobId + " is already terminal (" + state.wireName() + ")");
        this.state = state;
    }

    public Job.State getState() {
        return state;
    }
}
