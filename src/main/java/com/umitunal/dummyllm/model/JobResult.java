package com.umitunal.dummyllm.model;

import java.util.Objects;

/**
 * Payload of a job that completed in state OK.
 */
public final class JobResult {
    private final String text;
    private final Usage usage;

    public JobResult(String text, Usage usage) {
        this.text = Objects.requireNonNull(text, "text");
        this.usage = Objects.requireNonNull(usage, "usage");
    }

    public String getText() { return text; }
    public Usage getUsage() { return usage; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobResult)) return false;
        JobResult that = (JobResult) o;
        return text.equals(that.text) && usage.equals(that.usage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, usage);
    }

    @Override
    public String toString() {
        return "JobResult{text='" + text + "', " + usage + "}";
    }
}
