package com.umitunal.dummyllm.response;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches when any of a set of keywords appears as a whole word, case-insensitive.
 * Unlike {@link SubstringMatcher}, "hi" does not match inside "this".
 */
public class KeywordMatcher implements MessageMatcher {
    private final Pattern pattern;

    public KeywordMatcher(String... keywords) {
        if (keywords == null || keywords.length == 0) {
            throw new IllegalArgumentException("at least one keyword is required");
        }
        String alternation = Arrays.stream(keywords)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.pattern = Pattern.compile("\\b(?:" + alternation + ")\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    @Override
    public Optional<String> match(String message) {
        Matcher m = pattern.matcher(message);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(message.substring(m.end()));
    }

    @Override
    public String toString() {
        return "keywords(" + pattern.pattern() + ")";
    }
}
