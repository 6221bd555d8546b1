package com.umitunal.dummyllm.response;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Case-insensitive regex match. The tail is capture group 1 when the pattern has
 * one, otherwise the text after the match.
 */
public class RegexMatcher implements MessageMatcher {
    private final Pattern pattern;

    public RegexMatcher(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    @Override
    public Optional<String> match(String message) {
        Matcher m = pattern.matcher(message);
        if (!m.find()) {
            return Optional.empty();
        }
        if (m.groupCount() >= 1 && m.group(1) != null) {
            return Optional.of(m.group(1));
        }
        return Optional.of(message.substring(m.end()));
    }

    @Override
    public String toString() {
        return "regex(" + pattern.pattern() + ")";
    }
}
