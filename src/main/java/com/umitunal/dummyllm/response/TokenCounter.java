package com.umitunal.dummyllm.response;

import java.util.regex.Pattern;

/**
 * Whitespace token counting used for usage reporting.
 */
public final class TokenCounter {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TokenCounter() {
    }

    public static int count(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(trimmed).length;
    }
}
