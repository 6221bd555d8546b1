package com.umitunal.dummyllm.core;

/**
 * Thrown when an operation names a job id the store does not know.
 */
public class JobNotFoundException extends SimulatorException {

    public JobNotFoundException(String jobId) {
        super(jobId, "Job not found: " + jobId);
    }
}
