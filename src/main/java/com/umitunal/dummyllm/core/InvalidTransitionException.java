package com.umitunal.dummyllm.core;

/**
 * Thrown when a non-terminal job is asked to move along an edge the state graph
 * does not allow, or when a transition precondition does not hold.
 */
public class InvalidTransitionException extends SimulatorException {
    private final Job.State fromState;
    private final Job.State toState;

    public InvalidTransitionException(String jobId, Job.State fromState, Job.State toState) {
        super(jobId, String.format("Invalid transition for job %s: %s -> %s", jobId,
                fromState.wireName(), toState == null ? "?" : toState.wireName()));
        this.fromState = fromState;
        this.toState = toState;
    }

    public Job.State getFromState() { return fromState; }
    public Job.State getToState() { return toState; }
}
