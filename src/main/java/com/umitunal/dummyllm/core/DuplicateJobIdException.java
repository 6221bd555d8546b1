package com.umitunal.dummyllm.core;

/**
 * Thrown when a job is created with an id that is already registered.
 */
public class DuplicateJobIdException extends SimulatorException {

    public DuplicateJobIdException(String jobId) {
        super(jobId, "Duplicate job id: " + jobId);
    }
}
