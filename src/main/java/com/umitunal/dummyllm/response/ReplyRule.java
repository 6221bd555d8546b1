package com.umitunal.dummyllm.response;

import java.util.List;
import java.util.Objects;

/**
 * A matcher paired with the reply templates it owns. Templates may contain
 * {@code {x}}, replaced by the reflected text that followed the match.
 */
public final class ReplyRule {
    private final MessageMatcher matcher;
    private final List<String> templates;

    public ReplyRule(MessageMatcher matcher, List<String> templates) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        if (templates == null || templates.isEmpty()) {
            throw new IllegalArgumentException("A reply rule needs at least one template");
        }
        this.templates = List.copyOf(templates);
    }

    public static ReplyRule of(MessageMatcher matcher, String... templates) {
        return new ReplyRule(matcher, List.of(templates));
    }

    public MessageMatcher getMatcher() { return matcher; }
    public List<String> getTemplates() { return templates; }

    @Override
    public String toString() {
        return "ReplyRule{" + matcher + ", templates=" + templates.size() + "}";
    }
}
