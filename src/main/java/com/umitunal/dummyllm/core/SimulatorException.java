package com.umitunal.dummyllm.core;

/**
 * Base class for operational errors raised by the simulator.
 *
 * These indicate caller misuse or a benign race. Simulated outcomes such as
 * SIM_FAIL or TIMEOUT are never thrown; they are recorded on the job.
 */
public class SimulatorException extends RuntimeException {
    private final String jobId;

    public SimulatorException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
