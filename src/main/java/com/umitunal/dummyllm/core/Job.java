package com.umitunal.dummyllm.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.dummyllm.model.JobError;
import com.umitunal.dummyllm.model.JobResult;

import java.util.Locale;

/**
 * Read-only view of a simulated job.
 */
public interface Job {

    /**
     * Gets the unique identifier for this job.
     */
    String getId();

    /**
     * Gets the current execution state.
     */
    State getState();

    /**
     * Gets the concrete mode resolved when the job was created.
     */
    Mode getMode();

    /**
     * Gets the operation name from the original request.
     */
    String getOp();

    /**
     * Gets the request arguments exactly as received.
     */
    ObjectNode getArgs();

    /**
     * Gets the client-declared timeout in milliseconds.
     */
    long getTimeoutMs();

    /**
     * Gets the client trace id, or null if none was sent.
     */
    String getTraceId();

    /**
     * Gets the generated result, present only in state {@link State#OK}.
     */
    JobResult getResult();

    /**
     * Gets the simulated error, present only in FAIL, TIMEOUT and CANCELLED.
     */
    JobError getError();

    /**
     * Checks if a client has asked for this job to be cancelled.
     */
    boolean isCancelRequested();

    /**
     * Checks if this job has reached a terminal state.
     */
    default boolean isTerminal() {
        return getState().isTerminal();
    }

    /**
     * Possible execution states for a job.
     */
    enum State {
        QUEUED,     // Created, executor not started yet
        RUNNING,    // Executor is waiting out the simulated latency
        OK,         // Completed with a result
        FAIL,       // Simulated failure
        TIMEOUT,    // Simulated timeout
        CANCELLED;  // Cancelled by a client

        public boolean isTerminal() {
            return this != QUEUED && this != RUNNING;
        }

        /**
         * Checks if moving from this state to {@code next} follows the state graph.
         * A queued job may only start running or be cancelled before it is in flight.
         */
        public boolean canTransitionTo(State next) {
            return switch (this) {
                case QUEUED -> next == RUNNING || next == CANCELLED;
                case RUNNING -> next.isTerminal();
                default -> false;
            };
        }

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
