package com.umitunal.dummyllm.response;

import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive substring match; the tail is everything after the first occurrence.
 */
public class SubstringMatcher implements MessageMatcher {
    private final String phrase;

    public SubstringMatcher(String phrase) {
        if (phrase == null || phrase.isEmpty()) {
            throw new IllegalArgumentException("phrase cannot be empty");
        }
        this.phrase = phrase.toLowerCase(Locale.ROOT);
    }

    @Override
    public Optional<String> match(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        int idx = lower.indexOf(phrase);
        if (idx < 0) {
            return Optional.empty();
        }
        int end = Math.min(message.length(), idx + phrase.length());
        return Optional.of(message.substring(end));
    }

    @Override
    public String toString() {
        return "substring(" + phrase + ")";
    }
}
