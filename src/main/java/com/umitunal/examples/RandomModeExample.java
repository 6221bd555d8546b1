package com.umitunal.examples;

import com.umitunal.dummyllm.JobSimulator;
import com.umitunal.dummyllm.config.ModeWeights;
import com.umitunal.dummyllm.config.SimulatorConfig;
import com.umitunal.dummyllm.core.Mode;
import com.umitunal.dummyllm.model.JobRecord;

import java.util.EnumMap;
import java.util.Map;

/**
 * Random mode - the same seed always produces the same sequence of modes.
 */
public class RandomModeExample {

    public static void main(String[] args) {
        System.out.println("=== Random Mode Example ===\n");

        SimulatorConfig config = SimulatorConfig.newBuilder()
                .withPolicy(Mode.RANDOM)
                .withWeights(ModeWeights.parse("ok=70,echo=10,slow=10,fail=5,hang=3,timeout=2,flaky=0"))
                .withSeed(1337)
                .withBaseLatencyMs(10)
                .build();

        Map<Mode, Integer> histogram = new EnumMap<>(Mode.class);
        StringBuilder firstModes = new StringBuilder();

        try (JobSimulator simulator = new JobSimulator(config)) {
            for (int i = 0; i < 200; i++) {
                JobRecord job = simulator.submit("llm.chat", BasicExample.chatArgs("hello #" + i), 8000, null);
                histogram.merge(job.getMode(), 1, Integer::sum);
                if (i < 10) {
                    firstModes.append(job.getMode().wireName()).append(' ');
                }
            }

            System.out.println("First 10 modes: " + firstModes.toString().trim());
            System.out.println("Histogram:      " + histogram);
            System.out.println("Draws consumed: " + simulator.drawCount());
            System.out.println(simulator.health());
        }
    }
}
