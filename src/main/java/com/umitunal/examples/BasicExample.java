package com.umitunal.examples;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.dummyllm.JobSimulator;
import com.umitunal.dummyllm.config.SimulatorConfig;
import com.umitunal.dummyllm.core.Mode;
import com.umitunal.dummyllm.model.JobRecord;

import java.util.concurrent.TimeUnit;

/**
 * Basic usage - submit a chat job and an echo job and wait for their results.
 */
public class BasicExample {

    public static void main(String[] args) throws Exception {
        System.out.println("=== Basic Example ===\n");

        for (Mode mode : new Mode[]{Mode.OK, Mode.ECHO}) {
            SimulatorConfig config = SimulatorConfig.newBuilder()
                    .withPolicy(mode)
                    .withBaseLatencyMs(100)
                    .build();

            try (JobSimulator simulator = new JobSimulator(config)) {
                JobRecord job = simulator.submit("llm.chat", chatArgs("I need a holiday."), 8000, "basic-" + mode.wireName());
                System.out.println("Submitted: " + job);

                JobRecord done = simulator.completion(job.getId()).get(5, TimeUnit.SECONDS);
                System.out.println("Finished:  " + done);
                System.out.println("Reply:     " + done.getResult().getText());
                System.out.println("Usage:     " + done.getResult().getUsage() + "\n");
            }
        }
    }

    static ObjectNode chatArgs(String content) {
        ObjectNode args = JsonNodeFactory.instance.objectNode();
        args.putArray("messages")
                .addObject()
                .put("role", "user")
                .put("content", content);
        return args;
    }
}
