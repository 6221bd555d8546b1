package com.umitunal.dummyllm.model;

import java.util.Objects;

/**
 * Token counts reported with a generated result.
 */
public final class Usage {
    private final int promptTokens;
    private final int completionTokens;

    public Usage(int promptTokens, int completionTokens) {
        this.promptTokens = promptTokens;
        this.completionTokens = completionTokens;
    }

    public int getPromptTokens() { return promptTokens; }
    public int getCompletionTokens() { return completionTokens; }

    public int getTotalTokens() {
        return promptTokens + completionTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Usage)) return false;
        Usage usage = (Usage) o;
        return promptTokens == usage.promptTokens && completionTokens == usage.completionTokens;
    }

    @Override
    public int hashCode() {
        return Objects.hash(promptTokens, completionTokens);
    }

    @Override
    public String toString() {
        return String.format("Usage{prompt=%d, completion=%d}", promptTokens, completionTokens);
    }
}
