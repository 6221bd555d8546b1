package com.umitunal;

import com.umitunal.examples.BasicExample;
import com.umitunal.examples.CancellationExample;
import com.umitunal.examples.RandomModeExample;

/**
 * Main class that runs all dummyllm examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== dummyllm Examples ===\n");

        BasicExample.main(args);
        RandomModeExample.main(args);
        CancellationExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
