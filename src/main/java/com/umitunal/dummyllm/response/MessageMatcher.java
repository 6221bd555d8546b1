package com.umitunal.dummyllm.response;

import java.util.Optional;

/**
 * Decides whether a reply rule applies to a user message.
 */
@FunctionalInterface
public interface MessageMatcher {

    /**
     * Match a message.
     *
     * @param message the user message, already trimmed
     * @return the text following the matched part, or empty if there is no match
     */
    Optional<String> match(String message);

    static MessageMatcher substring(String phrase) {
        return new SubstringMatcher(phrase);
    }

    static MessageMatcher keywords(String... words) {
        return new KeywordMatcher(words);
    }

    static MessageMatcher regex(String pattern) {
        return new RegexMatcher(pattern);
    }

    /**
     * Matches every message with nothing following.
     */
    static MessageMatcher always() {
        return message -> Optional.of("");
    }
}
