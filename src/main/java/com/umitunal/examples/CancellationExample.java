package com.umitunal.examples;

import com.umitunal.dummyllm.JobSimulator;
import com.umitunal.dummyllm.config.SimulatorConfig;
import com.umitunal.dummyllm.core.AlreadyTerminalException;
import com.umitunal.dummyllm.core.Mode;
import com.umitunal.dummyllm.model.JobRecord;

/**
 * Cancellation - a hanging job stays running until the client gives up on it.
 */
public class CancellationExample {

    public static void main(String[] args) throws Exception {
        System.out.println("=== Cancellation Example ===\n");

        SimulatorConfig config = SimulatorConfig.newBuilder()
                .withPolicy(Mode.HANG)
                .build();

        try (JobSimulator simulator = new JobSimulator(config)) {
            JobRecord job = simulator.submit("llm.chat", BasicExample.chatArgs("Are you there?"), 500, null);

            // Client-side timeout
            Thread.sleep(job.getTimeoutMs());
            System.out.println("After client timeout: " + simulator.get(job.getId()));

            JobRecord cancelled = simulator.cancel(job.getId());
            System.out.println("Cancelled:            " + cancelled + " " + cancelled.getError());

            try {
                simulator.cancel(job.getId());
            } catch (AlreadyTerminalException e) {
                System.out.println("Second cancel:        " + e.getMessage());
            }
        }
    }
}
