package com.umitunal.dummyllm.core;

import java.util.Locale;

/**
 * Simulated behaviors a job can be assigned.
 *
 * The first six constants are concrete modes that drive execution. {@link #FLAKY}
 * and {@link #RANDOM} are policies only: the resolver turns them into one of the
 * concrete modes when a job is created, so a stored job never carries them.
 * Declaration order is the canonical order used for weighted selection.
 */
public enum Mode {
    OK,         // Chat-style reply after base latency
    ECHO,       // Canonical echo of args.messages after base latency
    SLOW,       // Chat-style reply after six times base latency
    FAIL,       // SIM_FAIL after a short delay
    HANG,       // Stays running until cancelled
    TIMEOUT,    // TIMEOUT after base latency
    FLAKY,      // Policy: ok, fail or hang chosen per job
    RANDOM;     // Policy: weighted choice per job

    /**
     * Lower-case name used in configuration and reports.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Checks if this mode can be stored on a job and executed directly.
     */
    public boolean isConcrete() {
        return this != FLAKY && this != RANDOM;
    }

    /**
     * Parse a mode from its wire name, case-insensitive.
     *
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public static Mode fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Mode name cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode: " + value, e);
        }
    }
}
