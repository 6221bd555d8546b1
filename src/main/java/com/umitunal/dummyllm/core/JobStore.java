package com.umitunal.dummyllm.core;

import com.umitunal.dummyllm.model.JobRecord;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Concurrency-safe registry of simulated jobs keyed by id.
 *
 * All state changes go through {@link #transition} or {@link #requestCancel};
 * both are atomic per record, so the first terminal transition for a job wins.
 */
public interface JobStore {

    /**
     * Insert a new job in state QUEUED.
     *
     * @param record the job to insert
     * @return the job id
     * @throws DuplicateJobIdException if a job with the same id exists
     */
    String create(JobRecord record);

    /**
     * Get the current snapshot of a job.
     *
     * @throws JobNotFoundException if the id is unknown
     */
    JobRecord get(String id);

    /**
     * Atomically apply a state change to a job.
     *
     * @param id the job id
     * @param precondition checked against the current record before mutating
     * @param mutator produces the next record from the current one
     * @return the committed record
     * @throws JobNotFoundException if the id is unknown
     * @throws AlreadyTerminalException if the job is already terminal
     * @throws InvalidTransitionException if the precondition fails or the
     *         mutator leaves the state graph
     */
    JobRecord transition(String id, Predicate<JobRecord> precondition, UnaryOperator<JobRecord> mutator);

    /**
     * Flag a job for cancellation. Idempotent while the job is not terminal.
     *
     * @return the flagged record
     * @throws JobNotFoundException if the id is unknown
     * @throws AlreadyTerminalException if the job is already terminal
     */
    JobRecord requestCancel(String id);

    /**
     * Snapshot of all jobs in creation order.
     */
    List<JobRecord> list();

    /**
     * Get counts of jobs per state.
     */
    StoreMetrics getMetrics();
}
